package com.ryuqq.conduit.adapter.pipeline;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, Jitter를 곱하여
 * 여러 클라이언트의 재시도가 같은 순간에 몰리지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attemptNumber-1), maxDelay)
 * delay = exponential * uniform(1 - jitterFactor, 1 + jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=1s, jitterFactor=0.2):</strong></p>
 * <ul>
 *   <li>attemptNumber=1: 800 ~ 1200ms</li>
 *   <li>attemptNumber=2: 1600 ~ 2400ms</li>
 *   <li>attemptNumber=3: 3200 ~ 4800ms</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelay 기본 지연 시간 (양수여야 함)
     * @param maxDelay 최대 지연 시간 (baseDelay 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(Duration baseDelay, Duration maxDelay, double jitterFactor) {
        this(baseDelay, maxDelay, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 주입하여 생성 (테스트용).
     *
     * @param baseDelay 기본 지연 시간
     * @param maxDelay 최대 지연 시간
     * @param jitterFactor Jitter 비율
     * @param random [0, 1) 난수 공급자
     */
    public BackoffCalculator(Duration baseDelay, Duration maxDelay, double jitterFactor, DoubleSupplier random) {
        if (baseDelay == null || baseDelay.isZero() || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be positive (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptNumber 방금 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간
     * @throws IllegalArgumentException attemptNumber가 양수가 아닌 경우
     */
    public Duration delayFor(int attemptNumber) {
        if (attemptNumber <= 0) {
            throw new IllegalArgumentException(
                "attemptNumber must be positive (current: " + attemptNumber + ")"
            );
        }

        // shift가 long 범위를 넘으면 그대로 maxDelay
        int shift = Math.min(attemptNumber - 1, 62);
        long multiplier = 1L << shift;
        long exponential = baseDelayMs > maxDelayMs / multiplier
            ? maxDelayMs
            : Math.min(baseDelayMs * multiplier, maxDelayMs);

        double factor = 1.0 - jitterFactor + (2.0 * jitterFactor * random.getAsDouble());
        return Duration.ofMillis(Math.round(exponential * factor));
    }

    public Duration getBaseDelay() {
        return Duration.ofMillis(baseDelayMs);
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(maxDelayMs);
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
