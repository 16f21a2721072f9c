package com.ryuqq.conduit.application.pagination;

import com.ryuqq.conduit.core.model.Page;
import com.ryuqq.conduit.core.model.PageInfo;
import com.ryuqq.conduit.core.model.PageState;
import com.ryuqq.conduit.core.model.Pagination;

import java.util.Optional;

/**
 * 페이지 번호 전략.
 *
 * <p><strong>종료 조건:</strong></p>
 * <ol>
 *   <li>서버가 totalPages(&gt; 0)를 알려주면 page &lt; totalPages 동안 계속 (중간의 빈 페이지 포함)</li>
 *   <li>totalPages가 0이거나 메타데이터가 없으면 빈 페이지에서 종료하고,
 *       그 외에는 items &gt;= perPage 동안 계속 (perPage는 응답 값, 없으면 요청 값)</li>
 *   <li>perPage를 전혀 알 수 없으면 빈 페이지가 나올 때까지 계속</li>
 * </ol>
 *
 * <p>마지막 페이지가 정확히 perPage개이면 빈 페이지 요청이 한 번 더 나갑니다.
 * 서버가 totalPages를 알려주지 않는 엔드포인트에서는 이를 구분할 방법이 없습니다.</p>
 *
 * @param startPage 시작 페이지 (1 이상)
 * @param perPage 요청 페이지 크기 (null이면 서버 기본값)
 * @author Conduit Team
 * @since 1.0.0
 */
public record PageNumberStrategy(int startPage, Integer perPage) implements PaginationStrategy {

    public PageNumberStrategy {
        if (startPage <= 0) {
            throw new IllegalArgumentException("startPage must be positive (current: " + startPage + ")");
        }
        if (perPage != null && perPage <= 0) {
            throw new IllegalArgumentException("perPage must be positive (current: " + perPage + ")");
        }
    }

    @Override
    public PageState initialState() {
        return PageState.first(startPage, perPage);
    }

    @Override
    public Optional<PageState> nextState(PageState current, Page<?> page) {
        if (page == null) {
            return Optional.empty();
        }

        Pagination info = page.pagination();
        if (info instanceof PageInfo pageInfo && pageInfo.hasKnownTotalPages()) {
            int reportedPage = pageInfo.page() > 0 ? pageInfo.page() : current.page();
            return reportedPage < pageInfo.totalPages()
                ? Optional.of(current.nextPage())
                : Optional.empty();
        }

        if (page.isEmpty()) {
            return Optional.empty();
        }

        int expectedPageSize = effectivePerPage(info, current);
        if (expectedPageSize <= 0 || page.items().size() >= expectedPageSize) {
            return Optional.of(current.nextPage());
        }
        return Optional.empty();
    }

    private static int effectivePerPage(Pagination info, PageState current) {
        if (info != null && info.perPage() > 0) {
            return info.perPage();
        }
        return current.perPage() == null ? 0 : current.perPage();
    }
}
