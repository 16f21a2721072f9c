package com.ryuqq.conduit.application.pagination;

import com.ryuqq.conduit.core.model.Page;
import com.ryuqq.conduit.core.model.PageState;
import com.ryuqq.conduit.core.model.Pagination;

import java.util.Optional;

/**
 * 커서 전략.
 *
 * <p>커서 없이 시작하고, 응답의 커서가 null이 아니고 비어있지 않은 동안
 * 그 커서로 다음 페이지를 요청합니다. 필터(prefix, limit 등)는 호출자의
 * request-builder가 매 요청마다 그대로 붙입니다.</p>
 *
 * @param perPage 요청 페이지 크기 (null이면 서버 기본값)
 * @author Conduit Team
 * @since 1.0.0
 */
public record CursorStrategy(Integer perPage) implements PaginationStrategy {

    public CursorStrategy {
        if (perPage != null && perPage <= 0) {
            throw new IllegalArgumentException("perPage must be positive (current: " + perPage + ")");
        }
    }

    @Override
    public PageState initialState() {
        return PageState.first(1, perPage);
    }

    @Override
    public Optional<PageState> nextState(PageState current, Page<?> page) {
        if (page == null) {
            return Optional.empty();
        }
        Pagination info = page.pagination();
        if (info == null || !info.hasCursor()) {
            return Optional.empty();
        }
        return Optional.of(current.withCursor(info.cursor()));
    }
}
