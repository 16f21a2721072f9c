package com.ryuqq.conduit.adapter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conduit.core.decode.RawDecoders;
import com.ryuqq.conduit.core.decode.ResponseDecoder;
import com.ryuqq.conduit.core.model.ApiError;
import com.ryuqq.conduit.core.model.CursorInfo;
import com.ryuqq.conduit.core.model.Envelope;
import com.ryuqq.conduit.core.model.Page;
import com.ryuqq.conduit.core.model.PageInfo;
import com.ryuqq.conduit.core.model.Pagination;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON Envelope 디코더.
 *
 * <p>모든 응답 본문은 다음 형태의 Envelope입니다:</p>
 * <pre>
 * { "success": bool, "errors": [{code, message}], "messages": [...], "result": ..., "result_info": {...} }
 * </pre>
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ol>
 *   <li>HTTP 상태가 2xx가 아님 → HTTP_STATUS 실패 (본문은 파싱하지 않음)</li>
 *   <li>204 + 빈 본문 → Success(null), 그 외 빈 본문 → MALFORMED_RESPONSE</li>
 *   <li>JSON 파싱 실패, success 필드 없음, result 변환 실패 → MALFORMED_RESPONSE</li>
 *   <li>success == false → ApplicationFailure (HTTP 200이어도)</li>
 *   <li>success == true → Success(result)</li>
 * </ol>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ObjectMapper mapper = JsonBodies.defaultMapper();
 * EnvelopeDecoder<Zone> zone = EnvelopeDecoder.forResult(mapper, Zone.class);
 * EnvelopeDecoder<Page<DnsRecord>> records = EnvelopeDecoder.forPage(mapper, DnsRecord.class);
 * EnvelopeDecoder<Page<Bucket>> buckets = EnvelopeDecoder.forPage(mapper, Bucket.class, "buckets");
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public final class EnvelopeDecoder<T> implements ResponseDecoder<T> {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeDecoder.class);

    private static final int NO_CONTENT = 204;

    private final ObjectMapper mapper;
    private final ResultReader<T> resultReader;

    /**
     * result 노드와 pagination 메타데이터로 결과 값을 만든다.
     */
    @FunctionalInterface
    private interface ResultReader<T> {
        T read(JsonNode result, Pagination pagination) throws IOException;
    }

    private EnvelopeDecoder(ObjectMapper mapper, ResultReader<T> resultReader) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
        this.resultReader = resultReader;
    }

    /**
     * 단일 result 디코더.
     */
    public static <T> EnvelopeDecoder<T> forResult(ObjectMapper mapper, Class<T> type) {
        requireType(type);
        return forResult(mapper, mapper.constructType(type));
    }

    /**
     * 제네릭 result 디코더 (예: {@code List<Zone>}).
     */
    public static <T> EnvelopeDecoder<T> forResult(ObjectMapper mapper, TypeReference<T> type) {
        requireType(type);
        return forResult(mapper, mapper.getTypeFactory().constructType(type));
    }

    private static <T> EnvelopeDecoder<T> forResult(ObjectMapper mapper, JavaType javaType) {
        return new EnvelopeDecoder<>(mapper, (result, pagination) -> isAbsent(result)
            ? null
            : mapper.readerFor(javaType).readValue(result));
    }

    /**
     * 페이지 디코더. result가 항목 배열이고 result_info가 페이지 메타데이터입니다.
     */
    public static <T> EnvelopeDecoder<Page<T>> forPage(ObjectMapper mapper, Class<T> itemType) {
        return forPage(mapper, itemType, null);
    }

    /**
     * 페이지 디코더. 항목 배열이 result 안의 {@code itemsField}에 있는 응답용
     * (예: {@code "result": {"buckets": [...]}}).
     *
     * @param mapper ObjectMapper
     * @param itemType 항목 타입
     * @param itemsField result 안의 배열 필드 이름 (null이면 result 자체가 배열)
     */
    public static <T> EnvelopeDecoder<Page<T>> forPage(ObjectMapper mapper, Class<T> itemType, String itemsField) {
        requireType(itemType);
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, itemType);
        return new EnvelopeDecoder<>(mapper, (result, pagination) -> {
            JsonNode items = itemsField == null || isAbsent(result) ? result : result.get(itemsField);
            if (isAbsent(items)) {
                return new Page<>(List.of(), pagination);
            }
            if (!items.isArray()) {
                throw new MalformedEnvelopeException("expected an item array"
                    + (itemsField == null ? "" : " in result." + itemsField) + " but found " + items.getNodeType());
            }
            List<T> list = mapper.readerFor(listType).readValue(items);
            return new Page<>(list, pagination);
        });
    }

    /**
     * 커서 페이지 디코더. result_info를 {@link CursorInfo}로 해석합니다.
     */
    public static <T> EnvelopeDecoder<Page<T>> forCursorPage(ObjectMapper mapper, Class<T> itemType) {
        EnvelopeDecoder<Page<T>> pages = forPage(mapper, itemType, null);
        return new EnvelopeDecoder<>(mapper, (result, pagination) ->
            pages.resultReader.read(result, toCursorInfo(pagination)));
    }

    @Override
    public PipelineOutcome<T> decode(byte[] body, int statusCode) {
        if (statusCode < 200 || statusCode >= 300) {
            return TransportFailure.httpStatus(statusCode, RawDecoders.describeStatus(statusCode, body));
        }
        if (body == null || body.length == 0) {
            if (statusCode == NO_CONTENT) {
                return PipelineOutcome.success(null);
            }
            return TransportFailure.malformed(statusCode, null, "empty response body on HTTP " + statusCode);
        }

        Envelope<T> envelope;
        try {
            envelope = parseEnvelope(body);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Malformed envelope on HTTP {}: {}", statusCode, e.getMessage());
            return TransportFailure.malformed(statusCode, e, "malformed envelope: " + e.getMessage());
        }

        if (!envelope.success()) {
            return PipelineOutcome.applicationFailure(envelope.errors(), envelope.messages());
        }
        return PipelineOutcome.success(envelope.result());
    }

    /**
     * 본문을 Envelope로 파싱.
     *
     * @param body 응답 본문
     * @return 파싱된 Envelope (success == false면 result는 null)
     * @throws IOException JSON 문법 오류, Envelope 형태 위반, result 변환 실패
     */
    public Envelope<T> parseEnvelope(byte[] body) throws IOException {
        JsonNode root = mapper.readTree(body);
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("envelope must be a JSON object");
        }
        JsonNode success = root.get("success");
        if (success == null || !success.isBoolean()) {
            throw new MalformedEnvelopeException("envelope is missing boolean 'success'");
        }

        List<ApiError> errors = readErrors(root.get("errors"));
        List<String> messages = readMessages(root.get("messages"));
        if (!success.booleanValue()) {
            return new Envelope<>(false, errors, messages, null, null);
        }

        Pagination pagination = readPagination(root);
        T result = resultReader.read(root.get("result"), pagination);
        return new Envelope<>(true, errors, messages, result, pagination);
    }

    private static List<ApiError> readErrors(JsonNode node) throws MalformedEnvelopeException {
        if (isAbsent(node)) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MalformedEnvelopeException("'errors' must be an array");
        }
        List<ApiError> errors = new ArrayList<>(node.size());
        for (JsonNode error : node) {
            if (error.isObject()) {
                errors.add(new ApiError(error.path("code").asInt(0), textOrNull(error.get("message"))));
            } else {
                errors.add(new ApiError(0, error.asText()));
            }
        }
        return errors;
    }

    private static List<String> readMessages(JsonNode node) {
        if (isAbsent(node) || !node.isArray()) {
            return List.of();
        }
        List<String> messages = new ArrayList<>(node.size());
        for (JsonNode message : node) {
            // 문자열 또는 {code, message} 객체
            messages.add(message.isObject() && message.has("message")
                ? message.get("message").asText()
                : message.isValueNode() ? message.asText() : message.toString());
        }
        return messages;
    }

    private static Pagination readPagination(JsonNode root) {
        JsonNode info = root.get("result_info");
        if (isAbsent(info)) {
            info = root.get("cursor_result_info");
        }
        if (isAbsent(info) || !info.isObject()) {
            return null;
        }
        String cursor = readCursor(info);
        if (info.has("page") || info.has("total_pages") || info.has("total_count")) {
            return new PageInfo(
                info.path("page").asInt(0),
                info.path("per_page").asInt(0),
                info.path("count").asInt(0),
                info.path("total_count").asInt(0),
                info.path("total_pages").asInt(0),
                cursor
            );
        }
        return new CursorInfo(info.path("count").asInt(0), info.path("per_page").asInt(0), cursor);
    }

    private static String readCursor(JsonNode info) {
        String cursor = textOrNull(info.get("cursor"));
        if (cursor == null) {
            cursor = textOrNull(info.path("cursors").get("after"));
        }
        return cursor == null || cursor.isEmpty() ? null : cursor;
    }

    private static CursorInfo toCursorInfo(Pagination pagination) {
        if (pagination == null || pagination instanceof CursorInfo) {
            return (CursorInfo) pagination;
        }
        return new CursorInfo(pagination.count(), pagination.perPage(), pagination.cursor());
    }

    private static String textOrNull(JsonNode node) {
        return isAbsent(node) ? null : node.asText();
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static void requireType(Object type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    /**
     * Envelope 형태 위반.
     */
    static final class MalformedEnvelopeException extends JsonProcessingException {

        MalformedEnvelopeException(String message) {
            super(message);
        }
    }
}
