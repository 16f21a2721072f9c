package com.ryuqq.conduit.adapter.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.ryuqq.conduit.core.model.HttpVerb;
import com.ryuqq.conduit.core.model.RequestDescriptor;

/**
 * JSON 요청 본문 유틸리티.
 *
 * <p>API 규약: snake_case 필드 이름, null 필드 생략, 알 수 없는 응답 필드 무시.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class JsonBodies {

    private JsonBodies() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * API 규약에 맞춘 ObjectMapper 생성.
     *
     * @return 새 ObjectMapper
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * 요청 본문 직렬화.
     *
     * @param mapper ObjectMapper
     * @param body 본문 객체
     * @return UTF-8 JSON 바이트
     * @throws IllegalArgumentException 직렬화할 수 없는 객체인 경우
     */
    public static byte[] encode(ObjectMapper mapper, Object body) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        try {
            return mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body of type "
                + (body == null ? "null" : body.getClass().getName()), e);
        }
    }

    /**
     * JSON 본문을 가진 요청 생성.
     *
     * @param mapper ObjectMapper
     * @param verb HTTP 메서드
     * @param target 대상 경로
     * @param body 본문 객체
     * @return Content-Type이 설정된 요청
     */
    public static RequestDescriptor request(ObjectMapper mapper, HttpVerb verb, String target, Object body) {
        return RequestDescriptor.json(verb, target, encode(mapper, body));
    }
}
