package com.ryuqq.conduit.core.outcome;

import com.ryuqq.conduit.core.exception.ApiTransportException;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * 전송 계층 실패 또는 파이프라인 내부 거부.
 *
 * <p>{@link FailureKind}로 세부 원인을 구분합니다. 가능한 경우 HTTP 상태 코드,
 * 원인 예외, 서버가 보낸 {@code Retry-After} 지연을 함께 보존합니다.</p>
 *
 * @param kind 실패 분류
 * @param statusCode HTTP 상태 코드 (없으면 null)
 * @param cause 원인 예외 (없으면 null)
 * @param retryAfter 서버가 제시한 재시도 지연 (없으면 null)
 * @param detail 사람이 읽을 설명
 * @param <T> 성공 시 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record TransportFailure<T>(
    FailureKind kind,
    Integer statusCode,
    Throwable cause,
    Duration retryAfter,
    String detail
) implements PipelineOutcome<T> {

    public TransportFailure {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == FailureKind.HTTP_STATUS && statusCode == null) {
            throw new IllegalArgumentException("statusCode is required for HTTP_STATUS failures");
        }
        if (retryAfter != null && retryAfter.isNegative()) {
            retryAfter = Duration.ZERO;
        }
        detail = detail == null ? kind.name() : detail;
    }

    public static <T> TransportFailure<T> httpStatus(int statusCode, String detail) {
        return new TransportFailure<>(FailureKind.HTTP_STATUS, statusCode, null, null, detail);
    }

    public static <T> TransportFailure<T> connection(Throwable cause) {
        String detail = cause == null ? "connection failure" : cause.toString();
        return new TransportFailure<>(FailureKind.CONNECTION, null, cause, null, detail);
    }

    public static <T> TransportFailure<T> attemptTimeout(Duration timeout) {
        return new TransportFailure<>(FailureKind.ATTEMPT_TIMEOUT, null, null, null,
            "attempt timed out after " + timeout.toMillis() + "ms");
    }

    public static <T> TransportFailure<T> malformed(int statusCode, Throwable cause, String detail) {
        return new TransportFailure<>(FailureKind.MALFORMED_RESPONSE, statusCode, cause, null, detail);
    }

    public static <T> TransportFailure<T> invalidRequest(Throwable cause) {
        String detail = cause == null ? "invalid request" : "invalid request: " + cause.getMessage();
        return new TransportFailure<>(FailureKind.INVALID_REQUEST, null, cause, null, detail);
    }

    public static <T> TransportFailure<T> circuitOpen(String circuitName) {
        return new TransportFailure<>(FailureKind.CIRCUIT_OPEN, null, null, null,
            "circuit breaker '" + circuitName + "' is open");
    }

    public static <T> TransportFailure<T> rateLimiterRejected(int permitLimit, int queueLimit) {
        return new TransportFailure<>(FailureKind.RATE_LIMITER_REJECTED, null, null, null,
            "rate limiter rejected call (permitLimit=" + permitLimit + ", queueLimit=" + queueLimit + ")");
    }

    public static <T> TransportFailure<T> totalTimeout(Duration timeout) {
        return new TransportFailure<>(FailureKind.TOTAL_TIMEOUT, null, null, null,
            "operation timed out after " + timeout.toMillis() + "ms");
    }

    public static <T> TransportFailure<T> cancelled(String reason) {
        return new TransportFailure<>(FailureKind.CANCELLED, null, null, null,
            reason == null ? "cancelled" : "cancelled: " + reason);
    }

    /**
     * 상태 코드 조회.
     *
     * @return 상태 코드 (없으면 empty)
     */
    public Optional<Integer> status() {
        return Optional.ofNullable(statusCode);
    }

    /**
     * 특정 HTTP 상태 코드인지 확인.
     *
     * @param code 비교할 상태 코드
     * @return 일치하면 true
     */
    public boolean hasStatus(int code) {
        return statusCode != null && statusCode == code;
    }

    /**
     * 서버 재시도 지연을 설정한 새 인스턴스 생성.
     *
     * @param delay Retry-After 지연
     * @return 새 TransportFailure
     */
    public TransportFailure<T> withRetryAfter(Duration delay) {
        return new TransportFailure<>(kind, statusCode, cause, delay, detail);
    }

    /**
     * 대응하는 예외로 변환.
     *
     * @return ApiTransportException
     */
    public ApiTransportException toException() {
        return new ApiTransportException(this);
    }

    @Override
    public T getOrThrow() {
        throw toException();
    }

    @Override
    public <R> PipelineOutcome<R> map(Function<? super T, ? extends R> mapper) {
        return new TransportFailure<>(kind, statusCode, cause, retryAfter, detail);
    }
}
