package com.ryuqq.conduit.core.config;

import java.time.Duration;

/**
 * Resilience Pipeline 설정 (불변 record).
 *
 * <p>클라이언트 인스턴스 하나가 하나의 설정을 가지며, 인스턴스 간에 상태를 공유하지 않습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>permitLimit: 동시 실행 허용 수 (기본 10)</li>
 *   <li>queueLimit: 대기열 길이 (기본 100)</li>
 *   <li>maxRetries: 최대 재시도 횟수 (기본 2, 총 시도 = maxRetries + 1)</li>
 *   <li>baseDelay / maxDelay: backoff 기본값과 상한 (기본 1초 / 30초)</li>
 *   <li>attemptTimeout: 단일 시도 타임아웃 (기본 30초)</li>
 *   <li>totalTimeout: 재시도 포함 전체 타임아웃 (기본 60초)</li>
 *   <li>circuitBreakerMinimumThroughput: 차단 판단에 필요한 최소 표본 수 (기본 100)</li>
 *   <li>circuitBreakerBreakDuration: OPEN 유지 시간 (기본 5초)</li>
 *   <li>circuitBreakerFailureRatio: OPEN 전이 실패율 (기본 0.1)</li>
 *   <li>circuitBreakerSamplingDuration: 실패율 집계 윈도우 (기본 30초)</li>
 *   <li>rateLimitRetryEnabled: 429 재시도 여부 (기본 true)</li>
 *   <li>proactiveThrottlingEnabled: 쿼터 기반 선제 지연 여부 (기본 true)</li>
 *   <li>quotaLowThreshold: 선제 지연을 시작할 남은 쿼터 비율 (기본 0.1)</li>
 *   <li>jitterFactor: backoff jitter 폭 (기본 0.2, 배수 범위 [1-j, 1+j])</li>
 *   <li>maxThrottleDelay: 선제 지연 상한 (기본 10초)</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 * @param permitLimit 동시 실행 허용 수 (1 이상)
 * @param queueLimit 대기열 길이 (0 이상)
 * @param maxRetries 최대 재시도 횟수 (0 이상)
 * @param baseDelay backoff 기본 지연 (양수)
 * @param maxDelay backoff 최대 지연 (baseDelay 이상)
 * @param attemptTimeout 단일 시도 타임아웃 (양수)
 * @param totalTimeout 전체 타임아웃 (양수)
 * @param circuitBreakerMinimumThroughput 최소 표본 수 (1 이상)
 * @param circuitBreakerBreakDuration OPEN 유지 시간 (양수)
 * @param circuitBreakerFailureRatio OPEN 전이 실패율 (0 초과 1 이하)
 * @param circuitBreakerSamplingDuration 집계 윈도우 (양수)
 * @param rateLimitRetryEnabled 429 재시도 여부
 * @param proactiveThrottlingEnabled 선제 지연 여부
 * @param quotaLowThreshold 남은 쿼터 임계 비율 (0.0 ~ 1.0)
 * @param jitterFactor jitter 폭 (0.0 ~ 1.0)
 * @param maxThrottleDelay 선제 지연 상한 (0 이상)
 */
public record PipelineOptions(
    int permitLimit,
    int queueLimit,
    int maxRetries,
    Duration baseDelay,
    Duration maxDelay,
    Duration attemptTimeout,
    Duration totalTimeout,
    int circuitBreakerMinimumThroughput,
    Duration circuitBreakerBreakDuration,
    double circuitBreakerFailureRatio,
    Duration circuitBreakerSamplingDuration,
    boolean rateLimitRetryEnabled,
    boolean proactiveThrottlingEnabled,
    double quotaLowThreshold,
    double jitterFactor,
    Duration maxThrottleDelay
) {

    /**
     * 기본 설정 생성자.
     */
    public PipelineOptions() {
        this(10, 100, 2,
            Duration.ofSeconds(1), Duration.ofSeconds(30),
            Duration.ofSeconds(30), Duration.ofSeconds(60),
            100, Duration.ofSeconds(5), 0.1, Duration.ofSeconds(30),
            true, true, 0.1,
            0.2, Duration.ofSeconds(10));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PipelineOptions {
        if (permitLimit <= 0) {
            throw new IllegalArgumentException("permitLimit must be positive (current: " + permitLimit + ")");
        }
        if (queueLimit < 0) {
            throw new IllegalArgumentException("queueLimit cannot be negative (current: " + queueLimit + ")");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative (current: " + maxRetries + ")");
        }
        requirePositive("baseDelay", baseDelay);
        requirePositive("maxDelay", maxDelay);
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")"
            );
        }
        requirePositive("attemptTimeout", attemptTimeout);
        requirePositive("totalTimeout", totalTimeout);
        if (circuitBreakerMinimumThroughput <= 0) {
            throw new IllegalArgumentException(
                "circuitBreakerMinimumThroughput must be positive (current: " + circuitBreakerMinimumThroughput + ")"
            );
        }
        requirePositive("circuitBreakerBreakDuration", circuitBreakerBreakDuration);
        if (circuitBreakerFailureRatio <= 0.0 || circuitBreakerFailureRatio > 1.0) {
            throw new IllegalArgumentException(
                "circuitBreakerFailureRatio must be in (0.0, 1.0] (current: " + circuitBreakerFailureRatio + ")"
            );
        }
        requirePositive("circuitBreakerSamplingDuration", circuitBreakerSamplingDuration);
        if (quotaLowThreshold < 0.0 || quotaLowThreshold > 1.0) {
            throw new IllegalArgumentException(
                "quotaLowThreshold must be between 0.0 and 1.0 (current: " + quotaLowThreshold + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (maxThrottleDelay == null || maxThrottleDelay.isNegative()) {
            throw new IllegalArgumentException("maxThrottleDelay cannot be null or negative (current: " + maxThrottleDelay + ")");
        }
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    /**
     * 최대 시도 횟수 (최초 1회 + 재시도).
     *
     * @return maxRetries + 1
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    public PipelineOptions withPermitLimit(int permitLimit) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    public PipelineOptions withQueueLimit(int queueLimit) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    public PipelineOptions withMaxRetries(int maxRetries) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    /**
     * baseDelay와 maxDelay를 함께 변경한 새 인스턴스 생성.
     */
    public PipelineOptions withBackoff(Duration baseDelay, Duration maxDelay) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    public PipelineOptions withAttemptTimeout(Duration attemptTimeout) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    public PipelineOptions withTotalTimeout(Duration totalTimeout) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    /**
     * Circuit Breaker의 최소 표본 수와 OPEN 유지 시간을 변경한 새 인스턴스 생성.
     */
    public PipelineOptions withCircuitBreaker(int minimumThroughput, Duration breakDuration) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            minimumThroughput, breakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    public PipelineOptions withCircuitBreakerFailureRatio(double circuitBreakerFailureRatio) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    public PipelineOptions withCircuitBreakerSamplingDuration(Duration circuitBreakerSamplingDuration) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    public PipelineOptions withRateLimitRetryEnabled(boolean rateLimitRetryEnabled) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    /**
     * 선제 지연 설정을 변경한 새 인스턴스 생성.
     */
    public PipelineOptions withProactiveThrottling(boolean enabled, double quotaLowThreshold, Duration maxThrottleDelay) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, enabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }

    public PipelineOptions withJitterFactor(double jitterFactor) {
        return new PipelineOptions(permitLimit, queueLimit, maxRetries, baseDelay, maxDelay, attemptTimeout, totalTimeout,
            circuitBreakerMinimumThroughput, circuitBreakerBreakDuration, circuitBreakerFailureRatio, circuitBreakerSamplingDuration,
            rateLimitRetryEnabled, proactiveThrottlingEnabled, quotaLowThreshold, jitterFactor, maxThrottleDelay);
    }
}
