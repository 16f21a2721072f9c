package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * 파이프라인 안쪽 호출.
 *
 * <p>안쪽 stage 체인 전체(또는 가장 안쪽의 HTTP 시도)를 나타냅니다.
 * stage는 재시도, 타임아웃 등을 위해 여러 번 호출할 수 있습니다.</p>
 *
 * @param <T> 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PipelineCall<T> {

    /**
     * 호출 실행.
     *
     * @param token 이 호출에 적용할 취소 토큰
     * @return 분류된 결과 future (정상 완료)
     */
    CompletableFuture<PipelineOutcome<T>> invoke(CancellationToken token);
}
