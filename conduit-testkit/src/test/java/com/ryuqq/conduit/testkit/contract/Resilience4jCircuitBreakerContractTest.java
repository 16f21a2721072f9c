package com.ryuqq.conduit.testkit.contract;

import com.ryuqq.conduit.adapter.resilience4j.Resilience4jCircuitBreaker;
import com.ryuqq.conduit.core.config.PipelineOptions;
import com.ryuqq.conduit.core.protection.CircuitBreaker;

/**
 * Contract Test: the Circuit Breaker contract against {@link Resilience4jCircuitBreaker}.
 *
 * <p>Resilience4j keeps its own wall clock, so the break duration is waited out for real.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class Resilience4jCircuitBreakerContractTest extends CircuitBreakerContractTest {

    @Override
    protected CircuitBreaker circuitBreaker(PipelineOptions options) {
        return Resilience4jCircuitBreaker.of("contract-r4j", options);
    }

    @Override
    protected void elapseBreakDuration() {
        try {
            Thread.sleep(BREAK_DURATION.plusMillis(100).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for break duration", e);
        }
    }
}
