package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.classify.FailureClassifier;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import com.ryuqq.conduit.core.protection.CircuitBreaker;
import com.ryuqq.conduit.core.protection.CircuitPermit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Circuit Breaker stage.
 *
 * <p>재시도를 모두 마친 논리적 호출 하나의 결과를 breaker에 기록합니다.</p>
 * <ul>
 *   <li>허용되지 않으면 transport 호출 없이 CIRCUIT_OPEN</li>
 *   <li>CANCELLED로 끝나면 결과를 기록하지 않고 permit만 반납</li>
 *   <li>{@link FailureClassifier#isBreakerFailure}인 결과는 실패, 나머지는 성공으로 기록</li>
 * </ul>
 *
 * <p>결과는 tryAcquire가 발급한 {@link CircuitPermit}과 함께 기록합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class CircuitBreakerStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerStage.class);

    private final CircuitBreaker circuitBreaker;
    private final FailureClassifier classifier;
    private final Clock clock;

    public CircuitBreakerStage(CircuitBreaker circuitBreaker, FailureClassifier classifier, Clock clock) {
        if (circuitBreaker == null) {
            throw new IllegalArgumentException("circuitBreaker cannot be null");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.circuitBreaker = circuitBreaker;
        this.classifier = classifier;
        this.clock = clock;
    }

    @Override
    public <T> CompletableFuture<PipelineOutcome<T>> execute(RequestDescriptor request, PipelineCall<T> next,
                                                             CancellationToken token) {
        Optional<CircuitPermit> acquired = circuitBreaker.tryAcquire(request);
        if (acquired.isEmpty()) {
            log.warn("Circuit breaker {} is {}, rejecting {} {}",
                circuitBreaker.getName(), circuitBreaker.getState(), request.verb(), request.target());
            return CompletableFuture.completedFuture(TransportFailure.circuitOpen(circuitBreaker.getName()));
        }

        CircuitPermit permit = acquired.get();
        Instant startedAt = clock.instant();
        CompletableFuture<PipelineOutcome<T>> result = new CompletableFuture<>();
        Stages.invoke(next, token).whenComplete((outcome, error) -> {
            Duration elapsed = Duration.between(startedAt, clock.instant());
            try {
                record(permit, outcome, error, elapsed);
            } finally {
                Stages.relay(outcome, error, result);
            }
        });
        return result;
    }

    private void record(CircuitPermit permit, PipelineOutcome<?> outcome, Throwable error, Duration elapsed) {
        if (error != null) {
            circuitBreaker.recordFailure(permit, elapsed, Stages.unwrap(error));
            return;
        }
        if (outcome instanceof TransportFailure<?> failure) {
            if (failure.kind() == FailureKind.CANCELLED) {
                circuitBreaker.releasePermission(permit);
                return;
            }
            if (classifier.isBreakerFailure(failure)) {
                circuitBreaker.recordFailure(permit, elapsed, failure.toException());
                return;
            }
        }
        circuitBreaker.recordSuccess(permit, elapsed);
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
