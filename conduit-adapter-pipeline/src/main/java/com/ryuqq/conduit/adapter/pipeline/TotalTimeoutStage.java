package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 전체 타임아웃 (가장 바깥 stage).
 *
 * <p>재시도, 대기열 대기, 백오프를 모두 포함한 논리적 작업 하나의 상한입니다.
 * 시간이 다 되면 작업 토큰을 취소하고 안쪽 결과와 무관하게 TOTAL_TIMEOUT을 돌려줍니다.
 * 호출자가 취소하면 CANCELLED를 돌려줍니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class TotalTimeoutStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(TotalTimeoutStage.class);

    private final Duration timeout;
    private final ScheduledExecutorService scheduler;

    public TotalTimeoutStage(Duration timeout, ScheduledExecutorService scheduler) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    @Override
    public <T> CompletableFuture<PipelineOutcome<T>> execute(RequestDescriptor request, PipelineCall<T> next,
                                                             CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.completedFuture(TransportFailure.cancelled(token.reason()));
        }

        CancellationToken operationToken = token.child();
        CompletableFuture<PipelineOutcome<T>> result = new CompletableFuture<>();

        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            if (result.complete(TransportFailure.totalTimeout(timeout))) {
                log.warn("{} {} exceeded total timeout of {}ms", request.verb(), request.target(), timeout.toMillis());
                operationToken.cancel("total timeout of " + timeout.toMillis() + "ms elapsed");
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        CancellationToken.Registration callerCancel =
            token.onCancel(() -> result.complete(TransportFailure.cancelled(token.reason())));

        Stages.invoke(next, operationToken).whenComplete((outcome, error) -> {
            timer.cancel(false);
            callerCancel.remove();
            operationToken.detach();
            Stages.relay(outcome, error, result);
        });
        return result;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
