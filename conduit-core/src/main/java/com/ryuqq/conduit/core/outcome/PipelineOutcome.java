package com.ryuqq.conduit.core.outcome;

import com.ryuqq.conduit.core.model.ApiError;

import java.util.List;
import java.util.function.Function;

/**
 * 파이프라인 실행 결과.
 *
 * <p>PipelineOutcome은 정확히 세 가지 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Success}: 디코딩된 결과</li>
 *   <li>{@link ApplicationFailure}: 2xx 응답의 envelope이 {@code success:false}</li>
 *   <li>{@link TransportFailure}: 전송 실패, HTTP 상태 실패, 형식 오류, 파이프라인 내부 거부</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * PipelineOutcome<Zone> outcome = executor.execute(request, decoder);
 * if (outcome instanceof Success<Zone> success) {
 *     return success.value();
 * }
 * if (outcome instanceof ApplicationFailure<Zone> failure) {
 *     failure.errors().forEach(e -> log.warn("{}", e.format()));
 * }
 * Zone zone = outcome.getOrThrow();
 * }</pre>
 *
 * @param <T> 성공 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public sealed interface PipelineOutcome<T> permits Success, ApplicationFailure, TransportFailure {

    static <T> PipelineOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> PipelineOutcome<T> applicationFailure(List<ApiError> errors, List<String> messages) {
        return new ApplicationFailure<>(errors, messages);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * 성공 값을 꺼내거나, 실패를 대응하는 예외로 던짐.
     *
     * @return 성공 값 (null 가능)
     * @throws com.ryuqq.conduit.core.exception.ApiApplicationException ApplicationFailure인 경우
     * @throws com.ryuqq.conduit.core.exception.ApiTransportException TransportFailure인 경우
     */
    T getOrThrow();

    /**
     * 성공 값을 변환. 실패는 타입만 바꿔 그대로 전달합니다.
     *
     * @param mapper 변환 함수
     * @param <R> 변환 결과 타입
     * @return 변환된 PipelineOutcome
     */
    <R> PipelineOutcome<R> map(Function<? super T, ? extends R> mapper);
}
