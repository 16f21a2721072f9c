package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.model.QuotaSignal;

import java.util.Optional;

/**
 * 마지막으로 관측한 서버 할당량.
 *
 * <p>파이프라인 인스턴스마다 하나씩 존재하며, 응답의 rate-limit 헤더로 갱신됩니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class QuotaTracker {

    private volatile QuotaSignal latest;

    public void record(QuotaSignal signal) {
        if (signal != null) {
            this.latest = signal;
        }
    }

    public Optional<QuotaSignal> latest() {
        return Optional.ofNullable(latest);
    }
}
