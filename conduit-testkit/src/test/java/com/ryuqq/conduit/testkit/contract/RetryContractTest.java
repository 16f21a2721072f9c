package com.ryuqq.conduit.testkit.contract;

import com.ryuqq.conduit.core.model.HttpVerb;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Retry Stage and Failure Classifier.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Non-idempotent verbs are never retried, whatever the failure</li>
 *   <li>Idempotent verbs retry transient statuses (408, 5xx) and connection failures</li>
 *   <li>429 is retried only when rate-limit retry handling is enabled</li>
 *   <li>Exhaustion returns the last observed outcome unchanged</li>
 *   <li>A server Retry-After replaces the computed backoff</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class RetryContractTest extends AbstractPipelineContractTest {

    private static final RequestDescriptor GET_ZONES = RequestDescriptor.get("zones");

    @ParameterizedTest
    @EnumSource(value = HttpVerb.class, names = {"POST", "PATCH"})
    void testRetry_NonIdempotentVerb_InvokesTransportOnce(HttpVerb verb) {
        // Given: a transient failure followed by a success that must never be reached
        transport.respond(503, "").respond(200, successEnvelope("\"ok\""));

        // When
        PipelineOutcome<String> outcome = executor(fastOptions())
            .execute(RequestDescriptor.of(verb, "zones"), stringResult());

        // Then
        TransportFailure<?> failure = assertTransportFailure(outcome, FailureKind.HTTP_STATUS);
        assertEquals(503, failure.statusCode());
        assertEquals(1, transport.invocationCount(), "Non-idempotent request must be sent exactly once");
    }

    @Test
    void testRetry_NonIdempotentConnectionFailure_InvokesTransportOnce() {
        // Given
        transport.fail(new ConnectException("Connection refused")).respond(200, successEnvelope("\"ok\""));

        // When
        PipelineOutcome<String> outcome = executor(fastOptions())
            .execute(RequestDescriptor.of(HttpVerb.POST, "zones"), stringResult());

        // Then
        assertTransportFailure(outcome, FailureKind.CONNECTION);
        assertEquals(1, transport.invocationCount());
    }

    @ParameterizedTest
    @CsvSource({"GET, 503", "PUT, 500", "DELETE, 408", "HEAD, 502"})
    void testRetry_IdempotentTransientThenSuccess_InvokesTransportTwice(HttpVerb verb, int status) {
        // Given
        transport.respond(status, "").respond(200, successEnvelope("\"ok\""));

        // When
        PipelineOutcome<String> outcome = executor(fastOptions())
            .execute(RequestDescriptor.of(verb, "zones/1"), stringResult());

        // Then
        assertEquals("ok", assertSuccess(outcome));
        assertEquals(2, transport.invocationCount());
    }

    @Test
    void testRetry_ConnectionFailureThenSuccess_Retries() {
        // Given
        transport.fail(new ConnectException("Connection refused")).respond(200, successEnvelope("\"ok\""));

        // When
        PipelineOutcome<String> outcome = executor(fastOptions()).execute(GET_ZONES, stringResult());

        // Then
        assertEquals("ok", assertSuccess(outcome));
        assertEquals(2, transport.invocationCount());
    }

    @Test
    void testRetry_TooManyRequests_RetriedWhenEnabled() {
        // Given
        transport.respond(429, "").respond(200, successEnvelope("\"ok\""));

        // When
        PipelineOutcome<String> outcome = executor(fastOptions().withRateLimitRetryEnabled(true))
            .execute(GET_ZONES, stringResult());

        // Then
        assertEquals("ok", assertSuccess(outcome));
        assertEquals(2, transport.invocationCount());
    }

    @Test
    void testRetry_TooManyRequests_NotRetriedWhenDisabled() {
        // Given
        transport.respond(429, "").respond(200, successEnvelope("\"ok\""));

        // When
        PipelineOutcome<String> outcome = executor(fastOptions().withRateLimitRetryEnabled(false))
            .execute(GET_ZONES, stringResult());

        // Then
        TransportFailure<?> failure = assertTransportFailure(outcome, FailureKind.HTTP_STATUS);
        assertEquals(429, failure.statusCode());
        assertEquals(1, transport.invocationCount());
    }

    @Test
    void testRetry_ClientError_NotRetried() {
        // Given
        transport.respond(404, "");

        // When
        PipelineOutcome<String> outcome = executor(fastOptions()).execute(GET_ZONES, stringResult());

        // Then
        assertEquals(404, assertTransportFailure(outcome, FailureKind.HTTP_STATUS).statusCode());
        assertEquals(1, transport.invocationCount());
    }

    @Test
    void testRetry_Exhausted_ReturnsLastOutcomeUnchanged() {
        // Given: three different transient statuses, maxRetries = 2
        transport.respond(500, "").respond(502, "").respond(503, "");

        // When
        PipelineOutcome<String> outcome = executor(fastOptions().withMaxRetries(2))
            .execute(GET_ZONES, stringResult());

        // Then: the third (last) outcome surfaces
        TransportFailure<?> failure = assertTransportFailure(outcome, FailureKind.HTTP_STATUS);
        assertEquals(503, failure.statusCode());
        assertEquals(3, transport.invocationCount());
    }

    @Test
    void testRetry_RetryAfterHeader_TakesPrecedenceOverBackoff() {
        // Given: computed backoff would be at least 2.4s, the server asks for an immediate retry
        transport.respond(503, Map.of("Retry-After", List.of("0")), "")
            .respond(200, successEnvelope("\"ok\""));

        // When
        long startNanos = System.nanoTime();
        PipelineOutcome<String> outcome = executor(fastOptions()
            .withBackoff(Duration.ofSeconds(3), Duration.ofSeconds(5))
            .withTotalTimeout(Duration.ofSeconds(10)))
            .execute(GET_ZONES, stringResult());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);

        // Then
        assertEquals("ok", assertSuccess(outcome));
        assertEquals(2, transport.invocationCount());
        assertTrue(elapsed.compareTo(Duration.ofMillis(1500)) < 0,
            "Retry-After 0 should replace the backoff, elapsed: " + elapsed);
    }
}
