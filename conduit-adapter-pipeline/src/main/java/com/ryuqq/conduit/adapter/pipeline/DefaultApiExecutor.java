package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.application.executor.ApiExecutor;
import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.decode.ResponseDecoder;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link ApiExecutor} 기본 구현체.
 *
 * <p>모든 호출을 하나의 {@link ResiliencePipeline}으로 보냅니다.
 * 블로킹 호출은 결과 future를 기다리며, 대기 중 인터럽트되면 토큰을 취소하고
 * 인터럽트 상태를 복원한 뒤 CANCELLED 실패를 반환합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class DefaultApiExecutor implements ApiExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultApiExecutor.class);

    private final ResiliencePipeline pipeline;

    public DefaultApiExecutor(ResiliencePipeline pipeline) {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline cannot be null");
        }
        this.pipeline = pipeline;
    }

    @Override
    public <T> CompletableFuture<PipelineOutcome<T>> executeAsync(RequestDescriptor request, ResponseDecoder<T> decoder,
                                                                  CancellationToken token) {
        return pipeline.execute(request, decoder, token);
    }

    @Override
    public <T> PipelineOutcome<T> execute(RequestDescriptor request, ResponseDecoder<T> decoder,
                                          CancellationToken token) {
        CancellationToken callerToken = token == null ? CancellationToken.none() : token;
        CancellationToken callToken = callerToken.child();
        try {
            return pipeline.execute(request, decoder, callToken).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            callToken.cancel("caller thread interrupted");
            return TransportFailure.cancelled("caller thread interrupted");
        } catch (ExecutionException e) {
            Throwable cause = Stages.unwrap(e);
            log.error("Unexpected failure executing {} {}", request.verb(), request.target(), cause);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Pipeline execution failed", cause);
        } finally {
            callToken.detach();
        }
    }

    public ResiliencePipeline getPipeline() {
        return pipeline;
    }

    @Override
    public void close() {
        pipeline.close();
    }
}
