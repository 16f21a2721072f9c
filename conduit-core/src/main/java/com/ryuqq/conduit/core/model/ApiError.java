package com.ryuqq.conduit.core.model;

/**
 * Envelope의 {@code errors[]} 항목.
 *
 * @param code API 오류 코드
 * @param message 오류 메시지 (null이면 빈 문자열로 정규화)
 * @author Conduit Team
 * @since 1.0.0
 */
public record ApiError(int code, String message) {

    public ApiError {
        message = message == null ? "" : message;
    }

    /**
     * {@code [code] message} 형식 문자열.
     *
     * @return 포맷된 오류 문자열
     */
    public String format() {
        return "[" + code + "] " + message;
    }
}
