package com.ryuqq.conduit.core.protection.noop;

import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.protection.CircuitBreaker;
import com.ryuqq.conduit.core.protection.CircuitBreakerState;
import com.ryuqq.conduit.core.protection.CircuitPermit;

import java.time.Duration;
import java.util.Optional;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * Circuit Breaker 없이 파이프라인을 구성하고자 할 때 사용합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    @Override
    public Optional<CircuitPermit> tryAcquire(RequestDescriptor request) {
        return Optional.of(CircuitPermit.untracked(request));
    }

    @Override
    public void recordSuccess(CircuitPermit permit, Duration elapsed) {
        // NoOp
    }

    @Override
    public void recordFailure(CircuitPermit permit, Duration elapsed, Throwable throwable) {
        // NoOp
    }

    @Override
    public void releasePermission(CircuitPermit permit) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public String getName() {
        return "noop";
    }
}
