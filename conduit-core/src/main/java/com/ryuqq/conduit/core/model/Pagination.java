package com.ryuqq.conduit.core.model;

/**
 * Envelope의 {@code result_info} 페이지네이션 메타데이터.
 *
 * <p>페이지 번호 방식은 {@link PageInfo}, 커서 방식은 {@link CursorInfo}입니다.
 * 페이지 번호 응답도 커서를 함께 실을 수 있으므로 두 타입 모두 {@link #cursor()}를 가집니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public sealed interface Pagination permits PageInfo, CursorInfo {

    /**
     * 현재 페이지의 항목 수.
     *
     * @return 항목 수
     */
    int count();

    /**
     * 페이지 크기.
     *
     * @return 페이지 크기 (서버가 알려주지 않으면 0)
     */
    int perPage();

    /**
     * 다음 페이지 커서.
     *
     * @return 커서 (없으면 null)
     */
    String cursor();

    /**
     * 다음 페이지 커서가 있는지 확인.
     *
     * @return 커서가 null이 아니고 비어있지 않으면 true
     */
    default boolean hasCursor() {
        String cursor = cursor();
        return cursor != null && !cursor.isEmpty();
    }
}
