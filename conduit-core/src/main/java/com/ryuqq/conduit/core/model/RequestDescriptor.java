package com.ryuqq.conduit.core.model;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 하나의 논리적 HTTP 요청 기술자 (불변 record).
 *
 * <p>재시도 시 같은 기술자를 재사용하지만, 물리적 전송은 매번 새로운 transport 호출입니다.</p>
 *
 * <p>{@code target}은 base URI 기준 상대 경로 또는 절대 URL이며,
 * 쿼리 파라미터는 호출자가 이미 인코딩한 상태여야 합니다.</p>
 *
 * @param verb HTTP 메서드
 * @param target 요청 대상 (경로 + 인코딩된 쿼리)
 * @param body 직렬화된 요청 본문 (null 가능)
 * @param headers 요청별 추가 헤더
 * @author Conduit Team
 * @since 1.0.0
 */
public record RequestDescriptor(
    HttpVerb verb,
    String target,
    byte[] body,
    Map<String, String> headers
) {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException verb 또는 target이 null이거나 target이 빈 문자열인 경우
     */
    public RequestDescriptor {
        if (verb == null) {
            throw new IllegalArgumentException("verb cannot be null");
        }
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target cannot be null or blank");
        }
        body = body == null ? null : body.clone();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * 본문 없는 요청 생성.
     *
     * @param verb HTTP 메서드
     * @param target 요청 대상
     * @return RequestDescriptor
     */
    public static RequestDescriptor of(HttpVerb verb, String target) {
        return new RequestDescriptor(verb, target, null, Map.of());
    }

    /**
     * GET 요청 생성.
     *
     * @param target 요청 대상
     * @return RequestDescriptor
     */
    public static RequestDescriptor get(String target) {
        return of(HttpVerb.GET, target);
    }

    /**
     * JSON 본문 요청 생성 ({@code Content-Type: application/json}).
     *
     * @param verb HTTP 메서드
     * @param target 요청 대상
     * @param jsonBody 직렬화된 JSON 본문
     * @return RequestDescriptor
     */
    public static RequestDescriptor json(HttpVerb verb, String target, byte[] jsonBody) {
        return new RequestDescriptor(verb, target, jsonBody, Map.of(CONTENT_TYPE, APPLICATION_JSON));
    }

    /**
     * 멱등 요청인지 확인 (verb에서 유도).
     *
     * @return 멱등 여부
     */
    public boolean isIdempotent() {
        return verb.isIdempotent();
    }

    /**
     * 본문 존재 여부.
     *
     * @return 본문이 있으면 true
     */
    public boolean hasBody() {
        return body != null;
    }

    /**
     * 본문 사본 조회.
     *
     * @return 본문 사본 (본문이 없으면 null)
     */
    @Override
    public byte[] body() {
        return body == null ? null : body.clone();
    }

    /**
     * 헤더 하나를 추가한 새 인스턴스 생성.
     *
     * @param name 헤더 이름
     * @param value 헤더 값
     * @return 새 RequestDescriptor
     */
    public RequestDescriptor withHeader(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return new RequestDescriptor(verb, target, body, merged);
    }

    @Override
    public String toString() {
        String bodyInfo = body == null
            ? "none"
            : body.length + " bytes";
        return "RequestDescriptor[" + verb + " " + target + ", body=" + bodyInfo + "]";
    }

    /**
     * 본문을 UTF-8 문자열로 조회 (디버깅용).
     *
     * @return 본문 문자열 (본문이 없으면 null)
     */
    public String bodyAsString() {
        return body == null ? null : new String(body, StandardCharsets.UTF_8);
    }
}
