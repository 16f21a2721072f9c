package com.ryuqq.conduit.application.pagination;

import com.ryuqq.conduit.core.model.Page;
import com.ryuqq.conduit.core.model.PageState;

import java.util.Optional;

/**
 * 페이지네이션 전략.
 *
 * <p>첫 요청 상태와, 방금 가져온 페이지를 보고 다음 요청 상태(또는 종료)를 결정합니다.</p>
 *
 * <ul>
 *   <li>{@link PageNumberStrategy}: page / totalPages, 알 수 없으면 "가득 찬 페이지" 휴리스틱</li>
 *   <li>{@link CursorStrategy}: 응답의 커서가 비어있을 때까지</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface PaginationStrategy {

    /**
     * 첫 요청 상태.
     *
     * @return 첫 페이지 상태
     */
    PageState initialState();

    /**
     * 다음 요청 상태 결정.
     *
     * @param current 방금 요청한 상태
     * @param page 방금 받은 페이지
     * @return 다음 상태 (종료면 empty)
     */
    Optional<PageState> nextState(PageState current, Page<?> page);

    /**
     * 1페이지부터, 페이지 크기는 서버 기본값.
     */
    static PaginationStrategy pageNumber() {
        return new PageNumberStrategy(1, null);
    }

    /**
     * 시작 페이지와 페이지 크기를 지정한 페이지 번호 전략.
     */
    static PaginationStrategy pageNumber(int startPage, Integer perPage) {
        return new PageNumberStrategy(startPage, perPage);
    }

    /**
     * 커서 전략 (페이지 크기는 서버 기본값).
     */
    static PaginationStrategy cursor() {
        return new CursorStrategy(null);
    }

    /**
     * 페이지 크기를 지정한 커서 전략.
     */
    static PaginationStrategy cursor(Integer perPage) {
        return new CursorStrategy(perPage);
    }
}
