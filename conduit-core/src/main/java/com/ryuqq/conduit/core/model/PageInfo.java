package com.ryuqq.conduit.core.model;

/**
 * 페이지 번호 방식 메타데이터.
 *
 * <p>{@code totalPages == 0}은 "서버가 계산하지 않음"을 뜻하는 유효한 값입니다.
 * 이 경우 종료 판단은 페이지가 가득 찼는지(items &gt;= perPage)로 대신합니다.</p>
 *
 * @param page 현재 페이지 (1부터 시작)
 * @param perPage 페이지 크기
 * @param count 현재 페이지 항목 수
 * @param totalCount 전체 항목 수 (모르면 0)
 * @param totalPages 전체 페이지 수 (모르면 0)
 * @param cursor 함께 전달된 커서 (null 가능)
 * @author Conduit Team
 * @since 1.0.0
 */
public record PageInfo(
    int page,
    int perPage,
    int count,
    int totalCount,
    int totalPages,
    String cursor
) implements Pagination {

    /**
     * 커서 없이 생성.
     */
    public PageInfo(int page, int perPage, int count, int totalCount, int totalPages) {
        this(page, perPage, count, totalCount, totalPages, null);
    }

    /**
     * 서버가 전체 페이지 수를 알려주었는지 확인.
     *
     * @return totalPages가 양수이면 true
     */
    public boolean hasKnownTotalPages() {
        return totalPages > 0;
    }
}
