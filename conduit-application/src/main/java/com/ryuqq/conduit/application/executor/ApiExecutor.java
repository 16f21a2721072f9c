package com.ryuqq.conduit.application.executor;

import com.ryuqq.conduit.application.pagination.PagedIterable;
import com.ryuqq.conduit.application.pagination.PaginationStrategy;
import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.decode.ResponseDecoder;
import com.ryuqq.conduit.core.model.Page;
import com.ryuqq.conduit.core.model.PageState;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 리소스별 엔드포인트 코드가 사용하는 요청 실행 진입점.
 *
 * <p>모든 호출은 하나의 Resilience Pipeline을 통과합니다.
 * 실패는 예외가 아니라 분류된 {@link PipelineOutcome}으로 돌아오며,
 * 예외로 바꾸려면 {@link PipelineOutcome#getOrThrow()}를 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * PipelineOutcome<Zone> outcome = executor.execute(
 *     RequestDescriptor.get("zones/" + zoneId),
 *     EnvelopeDecoder.forResult(mapper, Zone.class)
 * );
 *
 * for (DnsRecord record : executor.paginate(
 *         PaginationStrategy.pageNumber(1, 100),
 *         state -> RequestDescriptor.get("zones/" + zoneId + "/dns_records?page=" + state.page() + "&per_page=100"),
 *         EnvelopeDecoder.forPage(mapper, DnsRecord.class))) {
 *     process(record);
 * }
 * }</pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface ApiExecutor extends AutoCloseable {

    /**
     * 논리적 작업 하나를 파이프라인 전체로 실행 (비동기).
     *
     * <p>반환된 future는 항상 정상 완료되며 실패는 {@link PipelineOutcome}으로 표현됩니다.</p>
     *
     * @param request 요청 기술자
     * @param decoder 응답 디코더
     * @param token 호출자 취소 토큰
     * @param <T> 결과 타입
     * @return 분류된 결과 future
     */
    <T> CompletableFuture<PipelineOutcome<T>> executeAsync(RequestDescriptor request, ResponseDecoder<T> decoder,
                                                           CancellationToken token);

    /**
     * 논리적 작업 하나를 파이프라인 전체로 실행 (블로킹).
     *
     * <p>호출 스레드가 인터럽트되면 토큰을 취소하고 CANCELLED 실패를 반환합니다.</p>
     *
     * @param request 요청 기술자
     * @param decoder 응답 디코더
     * @param token 호출자 취소 토큰
     * @param <T> 결과 타입
     * @return 분류된 결과
     */
    <T> PipelineOutcome<T> execute(RequestDescriptor request, ResponseDecoder<T> decoder, CancellationToken token);

    /**
     * 취소 없이 실행 (블로킹).
     */
    default <T> PipelineOutcome<T> execute(RequestDescriptor request, ResponseDecoder<T> decoder) {
        return execute(request, decoder, CancellationToken.none());
    }

    /**
     * 페이지네이션 실행.
     *
     * <p>결과는 지연 평가되며 한 번만 순회할 수 있습니다.
     * 페이지마다 {@link #execute(RequestDescriptor, ResponseDecoder, CancellationToken)}를 한 번 호출합니다.</p>
     *
     * @param strategy 페이지 번호 또는 커서 전략
     * @param buildRequest 페이지 상태로 요청을 만드는 함수 (필터는 호출자가 매번 그대로 붙임)
     * @param decoder 페이지 디코더
     * @param token 취소 토큰 (페이지 사이에서 확인)
     * @param <T> 항목 타입
     * @return 지연 항목 시퀀스
     */
    default <T> PagedIterable<T> paginate(PaginationStrategy strategy,
                                          Function<PageState, RequestDescriptor> buildRequest,
                                          ResponseDecoder<Page<T>> decoder,
                                          CancellationToken token) {
        if (buildRequest == null) {
            throw new IllegalArgumentException("buildRequest cannot be null");
        }
        if (decoder == null) {
            throw new IllegalArgumentException("decoder cannot be null");
        }
        return new PagedIterable<>(strategy, state -> execute(buildRequest.apply(state), decoder, token), token);
    }

    /**
     * 취소 없이 페이지네이션 실행.
     */
    default <T> PagedIterable<T> paginate(PaginationStrategy strategy,
                                          Function<PageState, RequestDescriptor> buildRequest,
                                          ResponseDecoder<Page<T>> decoder) {
        return paginate(strategy, buildRequest, decoder, CancellationToken.none());
    }

    /**
     * 실행기 종료 (스케줄러 등 리소스 정리).
     */
    @Override
    void close();
}
