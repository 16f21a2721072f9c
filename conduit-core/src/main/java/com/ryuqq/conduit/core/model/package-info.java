/**
 * 요청, 응답 envelope, 페이지네이션, 쿼터 신호 등 파이프라인이 주고받는 값 타입.
 *
 * <p>모든 타입은 불변 record 또는 enum입니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.model;
