package com.ryuqq.conduit.core.protection;

import com.ryuqq.conduit.core.cancel.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Bulkhead SPI.
 *
 * <p>동시 실행 수를 {@code permitLimit}로 제한하고, 초과 호출은
 * 길이 {@code queueLimit}의 FIFO 대기열에서 기다리게 합니다.
 * 대기열까지 가득 차면 즉시 거부합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * bulkhead.acquire(token).thenCompose(admitted -> {
 *     if (!admitted) {
 *         return completedFuture(TransportFailure.rateLimiterRejected(...));
 *     }
 *     return call().whenComplete((r, e) -> bulkhead.release());
 * });
 * }</pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * Bulkhead 진입 요청 (비블로킹).
     *
     * <p>반환된 future는 다음 중 하나로 완료됩니다:</p>
     * <ul>
     *   <li>true: 진입 허용 (즉시 또는 대기열에서 차례가 됨). 반드시 {@link #release()}로 반납</li>
     *   <li>false: 대기열 초과로 거부</li>
     *   <li>{@link java.util.concurrent.CancellationException}: 대기 중 토큰 취소 (대기열에서 제거됨)</li>
     * </ul>
     *
     * @param token 호출의 취소 토큰
     * @return 진입 결과 future
     */
    CompletableFuture<Boolean> acquire(CancellationToken token);

    /**
     * Bulkhead 진입 해제.
     *
     * <p>대기 중인 호출이 있으면 FIFO 순서로 다음 호출에 슬롯을 넘깁니다.</p>
     */
    void release();

    /**
     * 현재 동시 실행 수 조회.
     *
     * @return 진입 중인 호출 수
     */
    int getCurrentConcurrency();

    /**
     * 현재 대기 중인 호출 수 조회.
     *
     * @return 대기열 길이
     */
    int getQueuedCount();

    /**
     * Bulkhead 설정 정보 조회.
     *
     * @return Bulkhead 설정
     */
    BulkheadConfig getConfig();
}
