package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import com.ryuqq.conduit.core.protection.Bulkhead;
import com.ryuqq.conduit.core.protection.BulkheadConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 동시성 제한 + 선제 스로틀링 stage.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * ProactiveThrottle 지연 (permit을 잡지 않은 상태로 대기)
 *   ↓
 * Bulkhead.acquire
 *   - true  → 안쪽 호출, 완료 시 release
 *   - false → RATE_LIMITER_REJECTED
 *   - 대기 중 취소 → CANCELLED
 * </pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class RateLimiterStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterStage.class);

    private final Bulkhead bulkhead;
    private final ProactiveThrottle throttle;
    private final ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param bulkhead 동시성 제한기
     * @param throttle 선제 스로틀 (null이면 비활성)
     * @param scheduler 스로틀 타이머 스케줄러
     */
    public RateLimiterStage(Bulkhead bulkhead, ProactiveThrottle throttle, ScheduledExecutorService scheduler) {
        if (bulkhead == null) {
            throw new IllegalArgumentException("bulkhead cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.bulkhead = bulkhead;
        this.throttle = throttle;
        this.scheduler = scheduler;
    }

    @Override
    public <T> CompletableFuture<PipelineOutcome<T>> execute(RequestDescriptor request, PipelineCall<T> next,
                                                             CancellationToken token) {
        Duration delay = throttle == null ? Duration.ZERO : throttle.currentDelay();
        if (delay.isZero()) {
            return admit(request, next, token);
        }

        log.debug("Quota low, delaying {} {} by {}ms", request.verb(), request.target(), delay.toMillis());
        return ScheduledDelay.after(delay, token, scheduler).thenCompose(elapsed -> elapsed
            ? admit(request, next, token)
            : CompletableFuture.completedFuture(TransportFailure.cancelled(token.reason())));
    }

    private <T> CompletableFuture<PipelineOutcome<T>> admit(RequestDescriptor request, PipelineCall<T> next,
                                                            CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.completedFuture(TransportFailure.cancelled(token.reason()));
        }

        CompletableFuture<PipelineOutcome<T>> result = new CompletableFuture<>();
        bulkhead.acquire(token).whenComplete((admitted, error) -> {
            if (error != null) {
                Throwable cause = Stages.unwrap(error);
                if (cause instanceof CancellationException) {
                    result.complete(TransportFailure.cancelled(token.reason()));
                } else {
                    result.completeExceptionally(cause);
                }
                return;
            }
            if (!Boolean.TRUE.equals(admitted)) {
                BulkheadConfig config = bulkhead.getConfig();
                log.warn("Rate limiter rejected {} {} (permitLimit={}, queueLimit={})",
                    request.verb(), request.target(), config.permitLimit(), config.queueLimit());
                result.complete(TransportFailure.rateLimiterRejected(config.permitLimit(), config.queueLimit()));
                return;
            }
            Stages.invoke(next, token).whenComplete((outcome, failure) -> {
                bulkhead.release();
                Stages.relay(outcome, failure, result);
            });
        });
        return result;
    }

    public Bulkhead getBulkhead() {
        return bulkhead;
    }
}
