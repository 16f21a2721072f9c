package com.ryuqq.conduit.core.model;

/**
 * 커서 방식 메타데이터.
 *
 * <p>{@code cursor}가 null이거나 빈 문자열이면 더 이상 페이지가 없습니다.</p>
 *
 * @param count 현재 페이지 항목 수
 * @param perPage 페이지 크기 (모르면 0)
 * @param cursor 다음 페이지 커서 (null 가능)
 * @author Conduit Team
 * @since 1.0.0
 */
public record CursorInfo(int count, int perPage, String cursor) implements Pagination {
}
