package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 취소 가능한 비블로킹 대기.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
final class ScheduledDelay {

    private ScheduledDelay() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 지정 시간 후 true로 완료, 그 전에 토큰이 취소되면 즉시 false로 완료.
     *
     * @param delay 대기 시간
     * @param token 취소 토큰
     * @param scheduler 타이머 스케줄러
     * @return 대기 결과 future
     */
    static CompletableFuture<Boolean> after(Duration delay, CancellationToken token, ScheduledExecutorService scheduler) {
        if (token.isCancelled()) {
            return CompletableFuture.completedFuture(false);
        }
        if (delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(true);
        }

        CompletableFuture<Boolean> elapsed = new CompletableFuture<>();
        AtomicReference<CancellationToken.Registration> registration =
            new AtomicReference<>(CancellationToken.Registration.NONE);

        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            registration.get().remove();
            elapsed.complete(true);
        }, delay.toMillis(), TimeUnit.MILLISECONDS);

        registration.set(token.onCancel(() -> {
            timer.cancel(false);
            elapsed.complete(false);
        }));
        return elapsed;
    }
}
