package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Resilience Pipeline의 stage 하나.
 *
 * <p>각 stage는 안쪽 호출({@code next})을 감싸 자기 정책을 적용합니다.
 * 조합 순서 (안쪽 → 바깥쪽):</p>
 * <pre>
 * AttemptTimeout → Retry → CircuitBreaker → RateLimiter → TotalTimeout
 * </pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface PipelineStage {

    /**
     * 안쪽 호출에 정책 적용.
     *
     * @param request 요청 (분류, 로깅용)
     * @param next 안쪽 호출
     * @param token 바깥에서 받은 취소 토큰
     * @param <T> 결과 타입
     * @return 분류된 결과 future
     */
    <T> CompletableFuture<PipelineOutcome<T>> execute(RequestDescriptor request, PipelineCall<T> next,
                                                      CancellationToken token);
}
