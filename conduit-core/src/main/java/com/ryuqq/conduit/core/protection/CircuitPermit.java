package com.ryuqq.conduit.core.protection;

import com.ryuqq.conduit.core.model.RequestDescriptor;

/**
 * Circuit Breaker가 발급한 통과 허가.
 *
 * <p>{@code generation}은 허가를 발급한 시점의 breaker 상태 세대입니다.
 * breaker는 상태가 바뀔 때마다 세대를 올리고, 현재 세대와 다른 허가로 들어온 결과는 무시합니다.
 * 따라서 OPEN 이전에 시작된 호출이 늦게 끝나도 HALF_OPEN 시험 호출의 결과로 취급되지 않습니다.</p>
 *
 * @param request 허가를 받은 요청 (로깅용)
 * @param generation 발급 시점의 상태 세대
 * @author Conduit Team
 * @since 1.0.0
 */
public record CircuitPermit(RequestDescriptor request, long generation) {

    public CircuitPermit {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
    }

    /**
     * 상태를 추적하지 않는 breaker용 허가.
     */
    public static CircuitPermit untracked(RequestDescriptor request) {
        return new CircuitPermit(request, 0L);
    }
}
