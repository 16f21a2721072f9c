package com.ryuqq.conduit.testkit.contract;

import com.ryuqq.conduit.adapter.pipeline.DefaultApiExecutor;
import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.spi.TransportResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Rate Limiter Stage (bulkhead and proactive throttling).
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>permitLimit=1, queueLimit=0 rejects a concurrent call without invoking the transport</li>
 *   <li>permitLimit=1, queueLimit=1 admits one, queues one, rejects the third</li>
 *   <li>a cancelled waiter leaves the queue and never reaches the transport</li>
 *   <li>low advertised quota delays admission</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class RateLimiterContractTest extends AbstractPipelineContractTest {

    private static final RequestDescriptor GET_ZONES = RequestDescriptor.get("zones");
    private static final Duration WAIT = Duration.ofSeconds(2);

    @Test
    void testRateLimiter_SinglePermitNoQueue_RejectsConcurrentCall() throws Exception {
        // Given: the first call holds the only permit
        CompletableFuture<TransportResponse> held = new CompletableFuture<>();
        transport.respondWith(held).respond(200, successEnvelope("\"second\""));
        DefaultApiExecutor executor = executor(fastOptions().withPermitLimit(1).withQueueLimit(0));
        CompletableFuture<PipelineOutcome<String>> first =
            executor.executeAsync(GET_ZONES, stringResult(), CancellationToken.create());
        assertTrue(transport.awaitInvocations(1, WAIT));

        // When
        PipelineOutcome<String> second = executor.execute(GET_ZONES, stringResult());

        // Then
        assertTransportFailure(second, FailureKind.RATE_LIMITER_REJECTED);
        assertEquals(1, transport.invocationCount(), "Rejected call must not reach the transport");

        held.complete(TransportResponse.of(200, successEnvelope("\"first\"")));
        assertEquals("first", assertSuccess(first.get(2, TimeUnit.SECONDS)));
    }

    @Test
    void testRateLimiter_SinglePermitSingleQueueSlot_AdmitsTwoRejectsThird() throws Exception {
        // Given
        CompletableFuture<TransportResponse> held = new CompletableFuture<>();
        transport.respondWith(held).respond(200, successEnvelope("\"queued\""));
        DefaultApiExecutor executor = executor(fastOptions().withPermitLimit(1).withQueueLimit(1));

        // When
        CompletableFuture<PipelineOutcome<String>> first =
            executor.executeAsync(GET_ZONES, stringResult(), CancellationToken.create());
        assertTrue(transport.awaitInvocations(1, WAIT));
        CompletableFuture<PipelineOutcome<String>> second =
            executor.executeAsync(GET_ZONES, stringResult(), CancellationToken.create());
        PipelineOutcome<String> third = executor.execute(GET_ZONES, stringResult());

        // Then
        assertTransportFailure(third, FailureKind.RATE_LIMITER_REJECTED);
        assertFalse(second.isDone(), "Second call should be waiting in the queue");
        assertEquals(1, transport.invocationCount());

        // When: the permit is released
        held.complete(TransportResponse.of(200, successEnvelope("\"first\"")));

        // Then: the queued call runs
        assertEquals("first", assertSuccess(first.get(2, TimeUnit.SECONDS)));
        assertEquals("queued", assertSuccess(second.get(2, TimeUnit.SECONDS)));
        assertEquals(2, transport.invocationCount());
    }

    @Test
    void testRateLimiter_CancelledWaiter_IsDequeuedWithoutTransportCall() throws Exception {
        // Given
        CompletableFuture<TransportResponse> held = new CompletableFuture<>();
        transport.respondWith(held).respond(200, successEnvelope("\"later\""));
        DefaultApiExecutor executor = executor(fastOptions().withPermitLimit(1).withQueueLimit(1));
        CompletableFuture<PipelineOutcome<String>> first =
            executor.executeAsync(GET_ZONES, stringResult(), CancellationToken.create());
        assertTrue(transport.awaitInvocations(1, WAIT));

        CancellationToken waiterToken = CancellationToken.create();
        CompletableFuture<PipelineOutcome<String>> waiter = executor.executeAsync(GET_ZONES, stringResult(), waiterToken);

        // When
        waiterToken.cancel("caller gave up");

        // Then: the waiter is cancelled and its queue slot is free again
        assertTransportFailure(waiter.get(2, TimeUnit.SECONDS), FailureKind.CANCELLED);
        CompletableFuture<PipelineOutcome<String>> later =
            executor.executeAsync(GET_ZONES, stringResult(), CancellationToken.create());
        assertFalse(later.isDone(), "Freed queue slot should accept a new waiter");

        held.complete(TransportResponse.of(200, successEnvelope("\"first\"")));
        assertEquals("first", assertSuccess(first.get(2, TimeUnit.SECONDS)));
        assertEquals("later", assertSuccess(later.get(2, TimeUnit.SECONDS)));
        assertEquals(2, transport.invocationCount(), "Cancelled waiter must never reach the transport");
    }

    @Test
    void testRateLimiter_LowQuota_DelaysNextAdmission() {
        // Given: the server reports an exhausted quota that resets in 1 second
        transport.respond(200, Map.of(
                "RateLimit-Limit", List.of("100"),
                "RateLimit-Remaining", List.of("0"),
                "RateLimit-Reset", List.of("1")),
                successEnvelope("\"first\""))
            .respond(200, successEnvelope("\"second\""));
        DefaultApiExecutor executor = executor(fastOptions()
            .withProactiveThrottling(true, 0.1, Duration.ofMillis(300)));
        assertSuccess(executor.execute(GET_ZONES, stringResult()));

        // When
        long startNanos = System.nanoTime();
        PipelineOutcome<String> second = executor.execute(GET_ZONES, stringResult());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        // Then: delayed by the capped throttle delay
        assertEquals("second", assertSuccess(second));
        assertTrue(elapsed.compareTo(Duration.ofMillis(250)) >= 0, "Expected throttle delay, elapsed: " + elapsed);
    }

    @Test
    void testRateLimiter_ThrottlingDisabled_DoesNotDelay() {
        // Given
        transport.respond(200, Map.of(
                "RateLimit-Limit", List.of("100"),
                "RateLimit-Remaining", List.of("0"),
                "RateLimit-Reset", List.of("60")),
                successEnvelope("\"ok\""));
        DefaultApiExecutor executor = executor(fastOptions()
            .withProactiveThrottling(false, 0.1, Duration.ofSeconds(10)));
        assertSuccess(executor.execute(GET_ZONES, stringResult()));

        // When
        long startNanos = System.nanoTime();
        assertSuccess(executor.execute(GET_ZONES, stringResult()));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        // Then
        assertTrue(elapsed.compareTo(Duration.ofSeconds(5)) < 0, "Unexpected delay: " + elapsed);
    }
}
