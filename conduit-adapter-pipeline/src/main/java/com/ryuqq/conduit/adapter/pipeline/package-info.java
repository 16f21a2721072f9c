/**
 * Resilience Pipeline 구현.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.conduit.adapter.pipeline.ResiliencePipeline} - stage 조합과 소유 상태</li>
 *   <li>{@link com.ryuqq.conduit.adapter.pipeline.DefaultApiExecutor} - ApiExecutor 구현체</li>
 *   <li>{@link com.ryuqq.conduit.adapter.pipeline.PipelineStage} - stage 계약</li>
 *   <li>{@link com.ryuqq.conduit.adapter.pipeline.BackoffCalculator} - 지수 백오프 + jitter</li>
 *   <li>{@link com.ryuqq.conduit.adapter.pipeline.ProactiveThrottle} - 할당량 기반 선제 지연</li>
 * </ul>
 *
 * <p><strong>Stage:</strong></p>
 * <ul>
 *   <li>AttemptTimeoutStage, RetryStage, CircuitBreakerStage, RateLimiterStage, TotalTimeoutStage</li>
 * </ul>
 *
 * <p>모든 대기(백오프, 대기열, 스로틀)는 스케줄러 기반 비블로킹이며 취소 토큰으로 즉시 중단됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.pipeline;
