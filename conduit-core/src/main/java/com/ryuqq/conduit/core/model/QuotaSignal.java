package com.ryuqq.conduit.core.model;

import java.time.Instant;

/**
 * 서버가 rate-limit 헤더로 알려준 쿼터 상태.
 *
 * <p>파이프라인 인스턴스마다 마지막으로 관찰한 값 하나만 유지합니다 (last-write-wins).
 * 잠금 없이 읽으며, 오래된 값도 허용됩니다.</p>
 *
 * @param remaining 남은 요청 수
 * @param limit 윈도우당 허용 요청 수
 * @param windowResetAt 윈도우 리셋 시각
 * @author Conduit Team
 * @since 1.0.0
 */
public record QuotaSignal(long remaining, long limit, Instant windowResetAt) {

    public QuotaSignal {
        if (windowResetAt == null) {
            throw new IllegalArgumentException("windowResetAt cannot be null");
        }
        if (remaining < 0) {
            remaining = 0;
        }
    }

    /**
     * 남은 쿼터 비율.
     *
     * @return remaining / limit (limit이 0 이하이면 1.0)
     */
    public double remainingRatio() {
        if (limit <= 0) {
            return 1.0;
        }
        return (double) remaining / limit;
    }

    /**
     * 남은 쿼터가 임계값보다 낮은지 확인.
     *
     * @param threshold 임계 비율 (0.0 ~ 1.0)
     * @return remaining / limit &lt; threshold 이면 true
     */
    public boolean isBelow(double threshold) {
        return limit > 0 && remainingRatio() < threshold;
    }
}
