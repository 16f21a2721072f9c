package com.ryuqq.conduit.core.spi;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * transport가 돌려주는 원시 HTTP 응답.
 *
 * <p>헤더 이름은 대소문자를 구분하지 않고 조회합니다.</p>
 *
 * @param statusCode HTTP 상태 코드
 * @param headers 응답 헤더 (이름 → 값 목록)
 * @param body 응답 본문 (없으면 빈 배열)
 * @author Conduit Team
 * @since 1.0.0
 */
public record TransportResponse(int statusCode, Map<String, List<String>> headers, byte[] body) {

    public TransportResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be between 100 and 599 (current: " + statusCode + ")");
        }
        Map<String, List<String>> normalized = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null && values != null) {
                    normalized.put(name, List.copyOf(values));
                }
            });
        }
        headers = Collections.unmodifiableMap(normalized);
        body = body == null ? new byte[0] : body;
    }

    /**
     * 헤더 없는 응답 생성.
     */
    public static TransportResponse of(int statusCode, byte[] body) {
        return new TransportResponse(statusCode, Map.of(), body);
    }

    /**
     * UTF-8 본문 응답 생성.
     */
    public static TransportResponse of(int statusCode, String body) {
        return new TransportResponse(statusCode, Map.of(), body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 첫 번째 헤더 값 조회 (대소문자 무시).
     *
     * @param name 헤더 이름
     * @return 헤더 값 (없으면 empty)
     */
    public Optional<String> firstHeader(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
