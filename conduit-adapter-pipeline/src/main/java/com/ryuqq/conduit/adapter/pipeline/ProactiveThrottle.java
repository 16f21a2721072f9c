package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.model.QuotaSignal;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 할당량 기반 선제 지연 계산.
 *
 * <p>남은 할당량 비율이 threshold 미만이면 남은 요청을 윈도우 재설정 시각까지 고르게 분산합니다.</p>
 * <pre>
 * delay = min(maxDelay, (windowResetAt - now) / (remaining + 1))
 * </pre>
 * <p>신호가 없거나, 비율이 threshold 이상이거나, 재설정 시각이 지났으면 0입니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class ProactiveThrottle {

    private final double threshold;
    private final Duration maxDelay;
    private final QuotaTracker tracker;
    private final Clock clock;

    public ProactiveThrottle(double threshold, Duration maxDelay, QuotaTracker tracker, Clock clock) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0 (current: " + threshold + ")");
        }
        if (maxDelay == null || maxDelay.isNegative()) {
            throw new IllegalArgumentException("maxDelay must not be negative (current: " + maxDelay + ")");
        }
        if (tracker == null) {
            throw new IllegalArgumentException("tracker cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.threshold = threshold;
        this.maxDelay = maxDelay;
        this.tracker = tracker;
        this.clock = clock;
    }

    /**
     * 다음 호출 전 대기 시간.
     *
     * @return 대기 시간 (필요 없으면 {@link Duration#ZERO})
     */
    public Duration currentDelay() {
        QuotaSignal signal = tracker.latest().orElse(null);
        if (signal == null || !signal.isBelow(threshold)) {
            return Duration.ZERO;
        }
        Instant now = clock.instant();
        Duration untilReset = Duration.between(now, signal.windowResetAt());
        if (untilReset.isZero() || untilReset.isNegative()) {
            return Duration.ZERO;
        }
        Duration spread = untilReset.dividedBy(signal.remaining() + 1);
        return spread.compareTo(maxDelay) > 0 ? maxDelay : spread;
    }

    public QuotaTracker getTracker() {
        return tracker;
    }
}
