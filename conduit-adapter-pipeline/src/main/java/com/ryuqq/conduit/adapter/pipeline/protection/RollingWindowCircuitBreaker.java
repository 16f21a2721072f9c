package com.ryuqq.conduit.adapter.pipeline.protection;

import com.ryuqq.conduit.core.config.PipelineOptions;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.protection.CircuitBreaker;
import com.ryuqq.conduit.core.protection.CircuitBreakerState;
import com.ryuqq.conduit.core.protection.CircuitPermit;
import com.ryuqq.conduit.core.protection.CircuitTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 시간 구간 기반 실패율 Circuit Breaker.
 *
 * <p>samplingDuration을 10개 bucket으로 나누어 최근 호출의 성공/실패를 집계합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN: 표본 수 &gt;= minimumThroughput 이고 실패율 &gt;= failureRatio</li>
 *   <li>OPEN → HALF_OPEN: breakDuration 경과 후 첫 tryAcquire</li>
 *   <li>HALF_OPEN → CLOSED: 시험 호출 성공</li>
 *   <li>HALF_OPEN → OPEN: 시험 호출 실패, break 타이머 재시작</li>
 * </ul>
 *
 * <p>HALF_OPEN에서는 시험 호출 하나만 통과시킵니다. 모든 메서드는 인스턴스 단위로 동기화됩니다.</p>
 *
 * <p>상태가 바뀔 때마다 세대가 올라가며, 이전 세대의 허가로 들어온 결과와 반납은 무시합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class RollingWindowCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(RollingWindowCircuitBreaker.class);

    private static final int BUCKET_COUNT = 10;

    private final String name;
    private final int minimumThroughput;
    private final double failureRatio;
    private final Duration breakDuration;
    private final long bucketMillis;
    private final Clock clock;

    private final long[] bucketStart = new long[BUCKET_COUNT];
    private final int[] successes = new int[BUCKET_COUNT];
    private final int[] failures = new int[BUCKET_COUNT];

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private Instant openedAt;
    private boolean trialInFlight;
    private long generation;

    /**
     * 생성자.
     *
     * @param name breaker 이름 (로그, CIRCUIT_OPEN 상세에 사용)
     * @param minimumThroughput 판단에 필요한 최소 표본 수
     * @param failureRatio OPEN 전이 실패율 (0.0 초과 1.0 이하)
     * @param samplingDuration 집계 구간
     * @param breakDuration OPEN 유지 시간
     * @param clock 시계
     */
    public RollingWindowCircuitBreaker(String name, int minimumThroughput, double failureRatio,
                                       Duration samplingDuration, Duration breakDuration, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (minimumThroughput <= 0) {
            throw new IllegalArgumentException("minimumThroughput must be positive (current: " + minimumThroughput + ")");
        }
        if (failureRatio <= 0.0 || failureRatio > 1.0) {
            throw new IllegalArgumentException("failureRatio must be in (0.0, 1.0] (current: " + failureRatio + ")");
        }
        if (samplingDuration == null || samplingDuration.isZero() || samplingDuration.isNegative()) {
            throw new IllegalArgumentException("samplingDuration must be positive (current: " + samplingDuration + ")");
        }
        if (breakDuration == null || breakDuration.isZero() || breakDuration.isNegative()) {
            throw new IllegalArgumentException("breakDuration must be positive (current: " + breakDuration + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.minimumThroughput = minimumThroughput;
        this.failureRatio = failureRatio;
        this.breakDuration = breakDuration;
        this.bucketMillis = Math.max(1L, samplingDuration.toMillis() / BUCKET_COUNT);
        this.clock = clock;
        clearWindow();
    }

    /**
     * 파이프라인 옵션으로 생성.
     */
    public static RollingWindowCircuitBreaker of(String name, PipelineOptions options, Clock clock) {
        return new RollingWindowCircuitBreaker(
            name,
            options.circuitBreakerMinimumThroughput(),
            options.circuitBreakerFailureRatio(),
            options.circuitBreakerSamplingDuration(),
            options.circuitBreakerBreakDuration(),
            clock
        );
    }

    @Override
    public synchronized Optional<CircuitPermit> tryAcquire(RequestDescriptor request) {
        switch (state) {
            case CLOSED:
                return Optional.of(new CircuitPermit(request, generation));
            case OPEN:
                if (clock.instant().isBefore(openedAt.plus(breakDuration))) {
                    return Optional.empty();
                }
                moveTo(CircuitBreakerState.HALF_OPEN);
                trialInFlight = true;
                return Optional.of(new CircuitPermit(request, generation));
            case HALF_OPEN:
                if (trialInFlight) {
                    return Optional.empty();
                }
                trialInFlight = true;
                return Optional.of(new CircuitPermit(request, generation));
            default:
                throw new IllegalStateException("Unknown circuit state: " + state);
        }
    }

    @Override
    public synchronized void recordSuccess(CircuitPermit permit, Duration elapsed) {
        if (isStale(permit)) {
            log.debug("Circuit breaker {} ignored stale success of {} {}", name,
                permit.request().verb(), permit.request().target());
            return;
        }
        if (state == CircuitBreakerState.HALF_OPEN) {
            trialInFlight = false;
            moveTo(CircuitBreakerState.CLOSED);
            clearWindow();
            return;
        }
        if (state == CircuitBreakerState.CLOSED) {
            successes[currentBucket()]++;
        }
    }

    @Override
    public synchronized void recordFailure(CircuitPermit permit, Duration elapsed, Throwable throwable) {
        if (isStale(permit)) {
            log.debug("Circuit breaker {} ignored stale failure of {} {}", name,
                permit.request().verb(), permit.request().target());
            return;
        }
        if (state == CircuitBreakerState.HALF_OPEN) {
            trialInFlight = false;
            open();
            return;
        }
        if (state != CircuitBreakerState.CLOSED) {
            return;
        }

        failures[currentBucket()]++;
        int total = 0;
        int failed = 0;
        long windowStart = clock.millis() - bucketMillis * BUCKET_COUNT;
        for (int i = 0; i < BUCKET_COUNT; i++) {
            if (bucketStart[i] > windowStart) {
                total += successes[i] + failures[i];
                failed += failures[i];
            }
        }
        if (total >= minimumThroughput && (double) failed / total >= failureRatio) {
            log.debug("Circuit breaker {} failure ratio {}/{} reached threshold {}", name, failed, total, failureRatio);
            open();
        }
    }

    @Override
    public synchronized void releasePermission(CircuitPermit permit) {
        if (state == CircuitBreakerState.HALF_OPEN && !isStale(permit)) {
            trialInFlight = false;
        }
    }

    @Override
    public synchronized CircuitBreakerState getState() {
        return state;
    }

    @Override
    public synchronized void reset() {
        if (state != CircuitBreakerState.CLOSED) {
            log.info("Circuit breaker {} reset from {}", name, state);
        }
        state = CircuitBreakerState.CLOSED;
        generation++;
        openedAt = null;
        trialInFlight = false;
        clearWindow();
    }

    @Override
    public String getName() {
        return name;
    }

    private void open() {
        moveTo(CircuitBreakerState.OPEN);
        openedAt = clock.instant();
        clearWindow();
    }

    private void moveTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = CircuitTransition.transition(previous, next);
        generation++;
        log.info("Circuit breaker {} state {} → {}", name, previous, next);
    }

    private boolean isStale(CircuitPermit permit) {
        return permit.generation() != generation;
    }

    private int currentBucket() {
        long now = clock.millis();
        long start = now - Math.floorMod(now, bucketMillis);
        int index = (int) Math.floorMod(now / bucketMillis, (long) BUCKET_COUNT);
        if (bucketStart[index] != start) {
            bucketStart[index] = start;
            successes[index] = 0;
            failures[index] = 0;
        }
        return index;
    }

    private void clearWindow() {
        for (int i = 0; i < BUCKET_COUNT; i++) {
            bucketStart[i] = Long.MIN_VALUE;
            successes[i] = 0;
            failures[i] = 0;
        }
    }
}
