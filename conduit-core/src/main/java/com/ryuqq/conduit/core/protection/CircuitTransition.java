package com.ryuqq.conduit.core.protection;

/**
 * Circuit Breaker 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN</li>
 *   <li>OPEN → HALF_OPEN</li>
 *   <li>HALF_OPEN → CLOSED</li>
 *   <li>HALF_OPEN → OPEN</li>
 * </ul>
 *
 * <p>같은 상태로의 전이와 OPEN → CLOSED 직접 전이는 허용하지 않습니다.
 * 수동 {@code reset()}은 이 검증을 거치지 않습니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class CircuitTransition {

    // Utility class - prevent instantiation
    private CircuitTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        boolean valid;
        switch (from) {
            case CLOSED -> valid = to == CircuitBreakerState.OPEN;
            case OPEN -> valid = to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN -> valid = to == CircuitBreakerState.CLOSED || to == CircuitBreakerState.OPEN;
            default -> valid = false;
        }

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid circuit transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }
}
