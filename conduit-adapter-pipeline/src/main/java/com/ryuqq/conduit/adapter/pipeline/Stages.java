package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * stage 공용 유틸리티.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
final class Stages {

    private Stages() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 안쪽 호출. 동기적으로 던진 예외도 실패한 future로 바꿉니다.
     */
    static <T> CompletableFuture<PipelineOutcome<T>> invoke(PipelineCall<T> next, CancellationToken token) {
        try {
            CompletableFuture<PipelineOutcome<T>> future = next.invoke(token);
            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("PipelineCall returned null"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * {@link CompletionException}, {@link ExecutionException} 래핑 제거.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 안쪽 결과를 바깥 future로 전달.
     */
    static <T> void relay(PipelineOutcome<T> outcome, Throwable error, CompletableFuture<PipelineOutcome<T>> target) {
        if (error != null) {
            target.completeExceptionally(unwrap(error));
        } else {
            target.complete(outcome);
        }
    }
}
