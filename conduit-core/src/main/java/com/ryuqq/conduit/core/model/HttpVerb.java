package com.ryuqq.conduit.core.model;

/**
 * HTTP 메서드.
 *
 * <p>각 메서드는 멱등성(idempotency) 여부를 함께 가집니다.
 * 재시도 판단 시 멱등성은 다른 모든 조건보다 우선하는 게이트로 사용됩니다.</p>
 *
 * <ul>
 *   <li>멱등: GET, HEAD, OPTIONS, TRACE, PUT, DELETE</li>
 *   <li>비멱등: POST, PATCH</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public enum HttpVerb {

    GET(true),
    HEAD(true),
    OPTIONS(true),
    TRACE(true),
    PUT(true),
    DELETE(true),
    POST(false),
    PATCH(false);

    private final boolean idempotent;

    HttpVerb(boolean idempotent) {
        this.idempotent = idempotent;
    }

    /**
     * 멱등 메서드인지 확인.
     *
     * @return 동일 요청을 반복해도 서버 상태가 한 번 실행한 것과 같으면 true
     */
    public boolean isIdempotent() {
        return idempotent;
    }
}
