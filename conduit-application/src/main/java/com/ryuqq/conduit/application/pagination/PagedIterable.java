package com.ryuqq.conduit.application.pagination;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.exception.ApiPaginationException;
import com.ryuqq.conduit.core.model.Page;
import com.ryuqq.conduit.core.model.PageState;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.Success;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 지연 평가, 전방 전용, 재시작 불가 항목 시퀀스.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>소비자가 현재 페이지 너머의 항목을 요청할 때만 다음 페이지를 가져옴 (선반입 없음)</li>
 *   <li>{@link #iterator()}는 한 번만 호출 가능, 두 번째 호출은 {@link IllegalStateException}</li>
 *   <li>페이지 요청 전마다 취소 토큰을 확인, 취소됐으면 요청 없이 {@link ApiPaginationException}</li>
 *   <li>중간 페이지 실패는 {@link ApiPaginationException}으로 전달, 이미 전달한 항목은 유효</li>
 * </ul>
 *
 * @param <T> 항목 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public final class PagedIterable<T> implements Iterable<T> {

    private static final Logger log = LoggerFactory.getLogger(PagedIterable.class);

    private final PaginationStrategy strategy;
    private final PageFetcher<T> fetcher;
    private final CancellationToken token;
    private final AtomicBoolean iterated = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param strategy 페이지네이션 전략
     * @param fetcher 페이지 조회 함수
     * @param token 취소 토큰
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PagedIterable(PaginationStrategy strategy, PageFetcher<T> fetcher, CancellationToken token) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher cannot be null");
        }
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        this.strategy = strategy;
        this.fetcher = fetcher;
        this.token = token;
    }

    @Override
    public Iterator<T> iterator() {
        if (!iterated.compareAndSet(false, true)) {
            throw new IllegalStateException("PagedIterable can only be iterated once");
        }
        return new PageIterator();
    }

    /**
     * 순차 Stream으로 변환. {@link #iterator()}와 마찬가지로 한 번만 사용할 수 있습니다.
     *
     * @return 항목 Stream
     */
    public Stream<T> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private final class PageIterator implements Iterator<T> {

        private PageState nextState = strategy.initialState();
        private Iterator<T> currentItems = Collections.emptyIterator();
        private long yielded;

        @Override
        public boolean hasNext() {
            while (!currentItems.hasNext()) {
                if (nextState == null) {
                    return false;
                }
                fetchNextPage();
            }
            return true;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            yielded++;
            return currentItems.next();
        }

        private void fetchNextPage() {
            PageState state = nextState;
            nextState = null;

            if (token.isCancelled()) {
                log.debug("Pagination cancelled before page {}: {}", state.page(), token.reason());
                throw new ApiPaginationException(TransportFailure.cancelled(token.reason()), state.page(), yielded);
            }

            PipelineOutcome<Page<T>> outcome = fetcher.fetch(state);
            if (!(outcome instanceof Success<Page<T>> success)) {
                log.warn("Pagination stopped at page {} after {} items", state.page(), yielded);
                throw new ApiPaginationException(outcome, state.page(), yielded);
            }

            Page<T> page = success.value();
            if (page == null) {
                return;
            }
            currentItems = page.items().iterator();
            nextState = strategy.nextState(state, page).orElse(null);
            log.debug("Fetched page {} ({} items, cursor={}, more={})",
                state.page(), page.items().size(), state.cursor(), nextState != null);
        }
    }
}
