package com.ryuqq.conduit.core.outcome;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * <p>{@code value}는 null일 수 있습니다 (예: 본문 없는 204 응답, envelope의 {@code result: null}).</p>
 *
 * @param value 디코딩된 결과
 * @param <T> 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements PipelineOutcome<T> {

    @Override
    public T getOrThrow() {
        return value;
    }

    @Override
    public <R> PipelineOutcome<R> map(Function<? super T, ? extends R> mapper) {
        return new Success<>(mapper.apply(value));
    }
}
