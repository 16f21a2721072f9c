package com.ryuqq.conduit.core.outcome;

import com.ryuqq.conduit.core.exception.ApiApplicationException;
import com.ryuqq.conduit.core.model.ApiError;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 애플리케이션 레벨 실패.
 *
 * <p>HTTP는 2xx였지만 envelope이 {@code success:false}를 선언한 경우입니다.
 * 논리/검증 오류이므로 재시도하지 않으며, Circuit Breaker 실패로도 집계하지 않습니다.</p>
 *
 * <p>모든 {@link ApiError}는 순서대로 보존되며 첫 번째 것으로 잘리지 않습니다.</p>
 *
 * @param errors 오류 목록
 * @param messages envelope 메시지 목록
 * @param <T> 성공 시 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record ApplicationFailure<T>(List<ApiError> errors, List<String> messages) implements PipelineOutcome<T> {

    public ApplicationFailure {
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        errors = List.copyOf(errors);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    /**
     * 모든 오류를 {@code [code] message; [code] message} 형식으로 연결.
     *
     * @return 연결된 오류 문자열
     */
    public String describe() {
        if (errors.isEmpty()) {
            return "no error details";
        }
        return errors.stream().map(ApiError::format).collect(Collectors.joining("; "));
    }

    /**
     * 대응하는 예외로 변환.
     *
     * @return ApiApplicationException
     */
    public ApiApplicationException toException() {
        return new ApiApplicationException(errors, messages);
    }

    @Override
    public T getOrThrow() {
        throw toException();
    }

    @Override
    public <R> PipelineOutcome<R> map(Function<? super T, ? extends R> mapper) {
        return new ApplicationFailure<>(errors, messages);
    }
}
