package com.ryuqq.conduit.adapter.resilience4j;

import com.ryuqq.conduit.core.config.PipelineOptions;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.protection.CircuitBreaker;
import com.ryuqq.conduit.core.protection.CircuitBreakerState;
import com.ryuqq.conduit.core.protection.CircuitPermit;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resilience4j 기반 {@link CircuitBreaker} 구현체.
 *
 * <p>기본 구현체({@code RollingWindowCircuitBreaker}) 대신 파이프라인 빌더에 주입할 수 있습니다.
 * 성공/실패 판정은 파이프라인의 실패 분류기가 하고, 이 클래스는 결과를 Resilience4j에 전달만 합니다.</p>
 *
 * <p><strong>설정 매핑 ({@link #of(String, PipelineOptions)}):</strong></p>
 * <ul>
 *   <li>TIME_BASED sliding window = circuitBreakerSamplingDuration (초)</li>
 *   <li>minimumNumberOfCalls = circuitBreakerMinimumThroughput</li>
 *   <li>failureRateThreshold = circuitBreakerFailureRatio * 100</li>
 *   <li>waitDurationInOpenState = circuitBreakerBreakDuration</li>
 *   <li>permittedNumberOfCallsInHalfOpenState = 1</li>
 * </ul>
 *
 * <p>상태 전이 이벤트마다 세대를 올리고, 이전 세대의 허가로 들어온 결과는 Resilience4j에 전달하지 않습니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class Resilience4jCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(Resilience4jCircuitBreaker.class);

    private final io.github.resilience4j.circuitbreaker.CircuitBreaker delegate;
    private final AtomicLong generation = new AtomicLong();

    /**
     * 이미 구성된 Resilience4j breaker를 감싼다.
     *
     * @param delegate Resilience4j CircuitBreaker
     */
    public Resilience4jCircuitBreaker(io.github.resilience4j.circuitbreaker.CircuitBreaker delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
        delegate.getEventPublisher().onStateTransition(event -> {
            generation.incrementAndGet();
            log.info("Circuit breaker {} state {} → {}", event.getCircuitBreakerName(),
                event.getStateTransition().getFromState(), event.getStateTransition().getToState());
        });
    }

    /**
     * 파이프라인 옵션으로 생성.
     *
     * @param name breaker 이름
     * @param options 파이프라인 옵션
     * @return 새 breaker
     */
    public static Resilience4jCircuitBreaker of(String name, PipelineOptions options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        int windowSeconds = (int) Math.max(1L, options.circuitBreakerSamplingDuration().toSeconds());
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.TIME_BASED)
            .slidingWindowSize(windowSeconds)
            .minimumNumberOfCalls(options.circuitBreakerMinimumThroughput())
            .failureRateThreshold((float) (options.circuitBreakerFailureRatio() * 100.0))
            .waitDurationInOpenState(options.circuitBreakerBreakDuration())
            .permittedNumberOfCallsInHalfOpenState(1)
            .build();
        return new Resilience4jCircuitBreaker(io.github.resilience4j.circuitbreaker.CircuitBreaker.of(name, config));
    }

    @Override
    public Optional<CircuitPermit> tryAcquire(RequestDescriptor request) {
        if (!delegate.tryAcquirePermission()) {
            return Optional.empty();
        }
        return Optional.of(new CircuitPermit(request, generation.get()));
    }

    @Override
    public void recordSuccess(CircuitPermit permit, Duration elapsed) {
        if (isStale(permit)) {
            log.debug("Circuit breaker {} ignored stale success of {} {}", delegate.getName(),
                permit.request().verb(), permit.request().target());
            return;
        }
        delegate.onSuccess(elapsed.toNanos(), TimeUnit.NANOSECONDS);
    }

    @Override
    public void recordFailure(CircuitPermit permit, Duration elapsed, Throwable throwable) {
        if (isStale(permit)) {
            log.debug("Circuit breaker {} ignored stale failure of {} {}", delegate.getName(),
                permit.request().verb(), permit.request().target());
            return;
        }
        delegate.onError(elapsed.toNanos(), TimeUnit.NANOSECONDS, throwable);
    }

    @Override
    public void releasePermission(CircuitPermit permit) {
        if (!isStale(permit)) {
            delegate.releasePermission();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        switch (delegate.getState()) {
            case OPEN:
            case FORCED_OPEN:
                return CircuitBreakerState.OPEN;
            case HALF_OPEN:
                return CircuitBreakerState.HALF_OPEN;
            default:
                return CircuitBreakerState.CLOSED;
        }
    }

    @Override
    public void reset() {
        delegate.reset();
        generation.incrementAndGet();
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    private boolean isStale(CircuitPermit permit) {
        return permit.generation() != generation.get();
    }

    /**
     * 감싼 Resilience4j breaker (메트릭 조회 등).
     */
    public io.github.resilience4j.circuitbreaker.CircuitBreaker getDelegate() {
        return delegate;
    }
}
