package com.ryuqq.conduit.core.decode;

import com.ryuqq.conduit.core.outcome.PipelineOutcome;

/**
 * 원시 응답 본문과 상태 코드를 분류된 결과로 변환합니다.
 *
 * <p>구현체는 결과 JSON 형태를 아는 호출자 쪽 코드입니다.
 * 디코딩 실패는 예외가 아니라 {@code MALFORMED_RESPONSE} 실패로 반환해야 합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResponseDecoder<T> {

    /**
     * 응답 디코딩.
     *
     * @param body 응답 본문 (빈 배열 가능)
     * @param statusCode HTTP 상태 코드
     * @return 분류된 결과
     */
    PipelineOutcome<T> decode(byte[] body, int statusCode);
}
