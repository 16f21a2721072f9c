package com.ryuqq.conduit.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (최소 표본 수 이상에서 실패율 임계값 도달)
 * OPEN (차단)
 *   │
 *   ▼ (break duration 경과 후 첫 호출)
 * HALF_OPEN (시험 호출 1건)
 *   │
 *   ├─► 성공 → CLOSED
 *   └─► 실패 → OPEN
 * </pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과, 실패율 추적).
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     */
    OPEN,

    /**
     * 반개방 상태 (시험 호출 하나만 통과).
     */
    HALF_OPEN
}
