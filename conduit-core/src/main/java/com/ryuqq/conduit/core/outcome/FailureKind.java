package com.ryuqq.conduit.core.outcome;

/**
 * {@link TransportFailure}의 세부 분류.
 *
 * <ul>
 *   <li>전송 실패: HTTP_STATUS, CONNECTION, ATTEMPT_TIMEOUT</li>
 *   <li>응답 형식 오류: MALFORMED_RESPONSE</li>
 *   <li>요청 구성 오류: INVALID_REQUEST</li>
 *   <li>파이프라인 내부 거부: CIRCUIT_OPEN, RATE_LIMITER_REJECTED, TOTAL_TIMEOUT, CANCELLED</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public enum FailureKind {

    /** 2xx가 아닌 HTTP 상태 코드. */
    HTTP_STATUS,

    /** 연결 거부, DNS 실패 등 전송 계층 예외. */
    CONNECTION,

    /** 단일 시도의 타임아웃 만료. */
    ATTEMPT_TIMEOUT,

    /** 2xx 응답이지만 envelope으로 해석할 수 없는 본문. */
    MALFORMED_RESPONSE,

    /** 잘못된 target URI, 허용되지 않는 헤더 등 전송 전에 요청을 만들 수 없음. */
    INVALID_REQUEST,

    /** Circuit Breaker OPEN 상태로 호출 차단. */
    CIRCUIT_OPEN,

    /** Rate Limiter 대기열 초과로 즉시 거부. */
    RATE_LIMITER_REJECTED,

    /** 전체 작업 타임아웃 만료. */
    TOTAL_TIMEOUT,

    /** 호출자 취소. */
    CANCELLED;

    /**
     * 일시적 전송 예외인지 확인 (재시도 후보).
     *
     * @return CONNECTION 또는 ATTEMPT_TIMEOUT이면 true
     */
    public boolean isTransientTransport() {
        return this == CONNECTION || this == ATTEMPT_TIMEOUT;
    }

    /**
     * 파이프라인 내부 거부 신호인지 확인.
     *
     * @return CIRCUIT_OPEN, RATE_LIMITER_REJECTED, TOTAL_TIMEOUT, CANCELLED 중 하나이면 true
     */
    public boolean isPipelineInternal() {
        return this == CIRCUIT_OPEN
            || this == RATE_LIMITER_REJECTED
            || this == TOTAL_TIMEOUT
            || this == CANCELLED;
    }
}
