package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.classify.FailureClassifier;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.model.RetryState;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 재시도 stage.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>안쪽 호출(시도 하나) 실행</li>
 *   <li>{@link FailureClassifier#shouldRetry}가 false면 결과를 그대로 반환</li>
 *   <li>대기 시간 결정: 서버 Retry-After가 있으면 그 값, 없으면 {@link BackoffCalculator}</li>
 *   <li>비블로킹 대기 후 다시 1번. 대기 중 취소되면 즉시 CANCELLED</li>
 * </ol>
 *
 * <p>총 시도 횟수는 maxRetries + 1을 넘지 않습니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class RetryStage implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(RetryStage.class);

    private final int maxAttempts;
    private final FailureClassifier classifier;
    private final BackoffCalculator backoffCalculator;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param maxAttempts 최대 시도 횟수 (첫 시도 포함, 1 이상)
     * @param classifier 실패 분류기
     * @param backoffCalculator 백오프 계산기
     * @param scheduler 재시도 타이머 스케줄러
     * @param clock 경과 시간 측정용 시계
     */
    public RetryStage(int maxAttempts, FailureClassifier classifier, BackoffCalculator backoffCalculator,
                      ScheduledExecutorService scheduler, Clock clock) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (classifier == null) {
            throw new IllegalArgumentException("classifier cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.maxAttempts = maxAttempts;
        this.classifier = classifier;
        this.backoffCalculator = backoffCalculator;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public <T> CompletableFuture<PipelineOutcome<T>> execute(RequestDescriptor request, PipelineCall<T> next,
                                                             CancellationToken token) {
        CompletableFuture<PipelineOutcome<T>> result = new CompletableFuture<>();
        attempt(request, next, token, RetryState.initial(), clock.instant(), result);
        return result;
    }

    private <T> void attempt(RequestDescriptor request, PipelineCall<T> next, CancellationToken token,
                             RetryState state, Instant startedAt, CompletableFuture<PipelineOutcome<T>> result) {
        Stages.invoke(next, token).whenComplete((outcome, error) -> {
            if (error != null) {
                result.completeExceptionally(Stages.unwrap(error));
                return;
            }
            try {
                scheduleRetryOrComplete(request, next, token, state, startedAt, outcome, result);
            } catch (RuntimeException e) {
                log.error("Retry handling failed for {} {} after attempt {}",
                    request.verb(), request.target(), state.attemptNumber(), e);
                result.completeExceptionally(e);
            }
        });
    }

    private <T> void scheduleRetryOrComplete(RequestDescriptor request, PipelineCall<T> next, CancellationToken token,
                                             RetryState state, Instant startedAt, PipelineOutcome<T> outcome,
                                             CompletableFuture<PipelineOutcome<T>> result) {
        if (token.isCancelled()
            || !classifier.shouldRetry(outcome, request, state.attemptNumber(), maxAttempts)) {
            result.complete(outcome);
            return;
        }

        TransportFailure<T> failure = (TransportFailure<T>) outcome;
        Duration delay = failure.retryAfter() != null
            ? failure.retryAfter()
            : backoffCalculator.delayFor(state.attemptNumber());

        log.warn("Transient failure for {} {}. Attempt {}/{}. Next delay: {}ms ({})",
            request.verb(), request.target(), state.attemptNumber(), maxAttempts, delay.toMillis(),
            failure.detail());

        RetryState nextState = state.next(delay, Duration.between(startedAt, clock.instant()));
        ScheduledDelay.after(delay, token, scheduler).whenComplete((elapsed, delayError) -> {
            if (delayError != null) {
                result.completeExceptionally(Stages.unwrap(delayError));
            } else if (elapsed) {
                attempt(request, next, token, nextState, startedAt, result);
            } else {
                result.complete(TransportFailure.cancelled(token.reason()));
            }
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
