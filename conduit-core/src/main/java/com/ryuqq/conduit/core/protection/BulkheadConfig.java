package com.ryuqq.conduit.core.protection;

/**
 * Bulkhead 설정.
 *
 * @param permitLimit 최대 동시 실행 수
 * @param queueLimit 최대 대기열 길이 (0이면 대기 없이 거부)
 * @author Conduit Team
 * @since 1.0.0
 */
public record BulkheadConfig(int permitLimit, int queueLimit) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if permitLimit is not positive
     * @throws IllegalArgumentException if queueLimit is negative
     */
    public BulkheadConfig {
        if (permitLimit <= 0) {
            throw new IllegalArgumentException("permitLimit must be positive (current: " + permitLimit + ")");
        }
        if (queueLimit < 0) {
            throw new IllegalArgumentException("queueLimit cannot be negative (current: " + queueLimit + ")");
        }
    }
}
