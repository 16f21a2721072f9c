package com.ryuqq.conduit.core.model;

import java.time.Duration;

/**
 * 하나의 논리적 호출이 소유하는 재시도 상태.
 *
 * <p>동시 호출 간에 공유되지 않습니다.</p>
 *
 * @param attemptNumber 현재 시도 번호 (1부터 시작)
 * @param lastDelay 직전 대기 시간
 * @param elapsedSinceStart 첫 시도 이후 경과 시간
 * @author Conduit Team
 * @since 1.0.0
 */
public record RetryState(int attemptNumber, Duration lastDelay, Duration elapsedSinceStart) {

    public RetryState {
        if (attemptNumber <= 0) {
            throw new IllegalArgumentException("attemptNumber must be positive (current: " + attemptNumber + ")");
        }
        lastDelay = lastDelay == null ? Duration.ZERO : lastDelay;
        elapsedSinceStart = elapsedSinceStart == null ? Duration.ZERO : elapsedSinceStart;
    }

    /**
     * 첫 시도 상태.
     */
    public static RetryState initial() {
        return new RetryState(1, Duration.ZERO, Duration.ZERO);
    }

    /**
     * 다음 시도 상태.
     *
     * @param delay 이번에 대기할 시간
     * @param elapsed 첫 시도 이후 경과 시간
     * @return attemptNumber + 1 상태
     */
    public RetryState next(Duration delay, Duration elapsed) {
        return new RetryState(attemptNumber + 1, delay, elapsed);
    }
}
