package com.ryuqq.conduit.core.decode;

import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * envelope 파싱을 거치지 않는 원시 응답 디코더.
 *
 * <p>KV 값 조회처럼 본문 자체가 데이터인 엔드포인트에 사용합니다.</p>
 *
 * <ul>
 *   <li>2xx: 본문을 그대로 Success(Optional.of(...))</li>
 *   <li>404: Success(Optional.empty())</li>
 *   <li>그 외: HTTP_STATUS 실패</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class RawDecoders {

    private static final int NOT_FOUND = 404;
    private static final int DETAIL_LIMIT = 512;

    private RawDecoders() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * UTF-8 문자열 디코더.
     *
     * @return 문자열 디코더
     */
    public static ResponseDecoder<Optional<String>> string() {
        return (body, statusCode) -> raw(body, statusCode)
            .map(bytes -> bytes.map(b -> new String(b, StandardCharsets.UTF_8)));
    }

    /**
     * 바이트 배열 디코더.
     *
     * @return 바이트 디코더
     */
    public static ResponseDecoder<Optional<byte[]>> bytes() {
        return RawDecoders::raw;
    }

    private static PipelineOutcome<Optional<byte[]>> raw(byte[] body, int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return PipelineOutcome.success(Optional.of(body == null ? new byte[0] : body));
        }
        if (statusCode == NOT_FOUND) {
            return PipelineOutcome.success(Optional.empty());
        }
        return TransportFailure.httpStatus(statusCode, describeStatus(statusCode, body));
    }

    /**
     * 상태 코드와 본문 일부로 오류 설명 생성.
     *
     * @param statusCode HTTP 상태 코드
     * @param body 응답 본문
     * @return 설명 문자열
     */
    public static String describeStatus(int statusCode, byte[] body) {
        if (body == null || body.length == 0) {
            return "HTTP " + statusCode;
        }
        String text = new String(body, StandardCharsets.UTF_8);
        if (text.length() > DETAIL_LIMIT) {
            text = text.substring(0, DETAIL_LIMIT) + "...";
        }
        return "HTTP " + statusCode + ": " + text;
    }
}
