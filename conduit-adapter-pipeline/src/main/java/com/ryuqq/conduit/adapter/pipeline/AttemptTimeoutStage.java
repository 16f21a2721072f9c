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
 * 시도 단위 타임아웃 (가장 안쪽 stage).
 *
 * <p>HTTP 시도 하나가 attemptTimeout 안에 끝나지 않으면 그 시도만 취소하고
 * ATTEMPT_TIMEOUT 실패를 돌려줍니다. 이 실패는 일시적이므로 바깥 Retry stage가 재시도합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class AttemptTimeoutStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(AttemptTimeoutStage.class);

    private final Duration timeout;
    private final ScheduledExecutorService scheduler;

    public AttemptTimeoutStage(Duration timeout, ScheduledExecutorService scheduler) {
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
        CancellationToken attemptToken = token.child();
        CompletableFuture<PipelineOutcome<T>> result = new CompletableFuture<>();

        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            if (result.complete(TransportFailure.attemptTimeout(timeout))) {
                log.debug("Attempt for {} {} timed out after {}ms", request.verb(), request.target(), timeout.toMillis());
                attemptToken.cancel("attempt timed out after " + timeout.toMillis() + "ms");
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        Stages.invoke(next, attemptToken).whenComplete((outcome, error) -> {
            timer.cancel(false);
            attemptToken.detach();
            Stages.relay(outcome, error, result);
        });
        return result;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
