package com.ryuqq.conduit.core.model;

/**
 * 페이지 요청 상태.
 *
 * <p>호출자의 request-builder가 이 값을 받아 페이지 요청을 만듭니다.
 * 페이지 번호 방식에서는 {@code page}를, 커서 방식에서는 {@code cursor}를 사용합니다.</p>
 *
 * @param page 요청할 페이지 번호 (1부터 시작)
 * @param perPage 요청할 페이지 크기 (null이면 서버 기본값)
 * @param cursor 요청할 커서 (첫 페이지는 null)
 * @author Conduit Team
 * @since 1.0.0
 */
public record PageState(int page, Integer perPage, String cursor) {

    public PageState {
        if (page <= 0) {
            throw new IllegalArgumentException("page must be positive (current: " + page + ")");
        }
        if (perPage != null && perPage <= 0) {
            throw new IllegalArgumentException("perPage must be positive (current: " + perPage + ")");
        }
    }

    /**
     * 첫 페이지 상태.
     *
     * @param startPage 시작 페이지
     * @param perPage 페이지 크기 (null 가능)
     * @return PageState
     */
    public static PageState first(int startPage, Integer perPage) {
        return new PageState(startPage, perPage, null);
    }

    /**
     * 다음 페이지 번호 상태.
     *
     * @return page + 1 상태
     */
    public PageState nextPage() {
        return new PageState(page + 1, perPage, null);
    }

    /**
     * 다음 커서 상태.
     *
     * @param nextCursor 서버가 돌려준 커서
     * @return 커서가 적용된 상태
     */
    public PageState withCursor(String nextCursor) {
        return new PageState(page + 1, perPage, nextCursor);
    }

    public boolean hasCursor() {
        return cursor != null && !cursor.isEmpty();
    }
}
