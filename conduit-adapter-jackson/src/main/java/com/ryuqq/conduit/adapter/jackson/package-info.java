/**
 * Jackson 기반 Envelope 디코딩과 JSON 본문 인코딩.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.adapter.jackson.EnvelopeDecoder} - Envelope 파싱과 결과 분류</li>
 *   <li>{@link com.ryuqq.conduit.adapter.jackson.JsonBodies} - 요청 본문 직렬화, 기본 ObjectMapper</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.jackson;
