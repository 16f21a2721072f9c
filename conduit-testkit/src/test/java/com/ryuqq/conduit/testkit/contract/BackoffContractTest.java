package com.ryuqq.conduit.testkit.contract;

import com.ryuqq.conduit.adapter.pipeline.BackoffCalculator;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: exponential backoff between retries.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class BackoffContractTest extends AbstractPipelineContractTest {

    private static final Duration BASE_DELAY = Duration.ofMillis(20);

    @Test
    void testBackoff_ThreeRetries_TotalDelayExceedsBaseDelay() {
        // Given
        transport.respond(503, "");

        // When
        PipelineOutcome<String> outcome = executor(fastOptions()
            .withMaxRetries(3)
            .withBackoff(BASE_DELAY, Duration.ofSeconds(1)))
            .execute(RequestDescriptor.get("zones"), stringResult());

        // Then
        assertTransportFailure(outcome, FailureKind.HTTP_STATUS);
        assertEquals(4, transport.invocationCount());
        List<Duration> gaps = transport.interAttemptDelays();
        Duration total = gaps.stream().reduce(Duration.ZERO, Duration::plus);
        assertTrue(total.compareTo(BASE_DELAY) > 0, "Total inter-attempt delay was " + total);
    }

    @Test
    void testBackoff_DelayGrowsExponentiallyAndIsCapped() {
        // Given: jitter fixed at the midpoint (factor 1.0)
        BackoffCalculator calculator = new BackoffCalculator(BASE_DELAY, Duration.ofMillis(100), 0.2, () -> 0.5);

        // Then
        assertEquals(Duration.ofMillis(20), calculator.delayFor(1));
        assertEquals(Duration.ofMillis(40), calculator.delayFor(2));
        assertEquals(Duration.ofMillis(80), calculator.delayFor(3));
        assertEquals(Duration.ofMillis(100), calculator.delayFor(4));
        assertEquals(Duration.ofMillis(100), calculator.delayFor(30));
    }

    @Test
    void testBackoff_JitterStaysWithinBounds() {
        // Given
        BackoffCalculator low = new BackoffCalculator(Duration.ofMillis(100), Duration.ofSeconds(1), 0.2, () -> 0.0);
        BackoffCalculator high = new BackoffCalculator(Duration.ofMillis(100), Duration.ofSeconds(1), 0.2, () -> 0.999);

        // Then
        assertEquals(Duration.ofMillis(80), low.delayFor(1));
        assertTrue(high.delayFor(1).compareTo(Duration.ofMillis(120)) <= 0);
        assertTrue(high.delayFor(1).compareTo(Duration.ofMillis(119)) >= 0);
    }
}
