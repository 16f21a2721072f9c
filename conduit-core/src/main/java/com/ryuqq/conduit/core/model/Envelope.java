package com.ryuqq.conduit.core.model;

import java.util.List;

/**
 * API 응답 공통 래퍼 {@code {success, errors[], messages[], result, result_info?}}.
 *
 * <p><strong>불변식:</strong> {@code success == false}이면 JSON에 어떤 값이 있었든
 * {@code result}는 null로 취급합니다.</p>
 *
 * @param success 애플리케이션 레벨 성공 여부
 * @param errors 오류 목록 (순서 보존)
 * @param messages 메시지 목록 (순서 보존)
 * @param result 결과 (실패 시 항상 null)
 * @param pagination 페이지네이션 메타데이터 (null 가능)
 * @param <T> 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record Envelope<T>(
    boolean success,
    List<ApiError> errors,
    List<String> messages,
    T result,
    Pagination pagination
) {

    public Envelope {
        errors = errors == null ? List.of() : List.copyOf(errors);
        messages = messages == null ? List.of() : List.copyOf(messages);
        if (!success) {
            result = null;
        }
    }
}
