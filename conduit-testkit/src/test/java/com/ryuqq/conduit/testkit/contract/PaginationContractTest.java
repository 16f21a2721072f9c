package com.ryuqq.conduit.testkit.contract;

import com.ryuqq.conduit.adapter.pipeline.DefaultApiExecutor;
import com.ryuqq.conduit.application.pagination.PagedIterable;
import com.ryuqq.conduit.application.pagination.PaginationStrategy;
import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.exception.ApiPaginationException;
import com.ryuqq.conduit.core.model.ApiError;
import com.ryuqq.conduit.core.model.PageState;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.ApplicationFailure;
import com.ryuqq.conduit.core.outcome.FailureKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: Pagination Engine over the full pipeline.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Page-number pagination honours totalPages</li>
 *   <li>Unknown totalPages falls back to the full-page heuristic</li>
 *   <li>Cursor pagination follows cursors and keeps caller filters</li>
 *   <li>Lazy, forward-only, single-use sequences</li>
 *   <li>Failures and cancellation between pages</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class PaginationContractTest extends AbstractPipelineContractTest {

    private static RequestDescriptor zonesPage(PageState state) {
        return RequestDescriptor.get("zones?page=" + state.page() + "&per_page=" + state.perPage());
    }

    private static RequestDescriptor bucketsPage(PageState state) {
        String target = "buckets?prefix=logs&limit=1";
        return RequestDescriptor.get(state.hasCursor() ? target + "&cursor=" + state.cursor() : target);
    }

    private static List<String> targets(ScriptedTransport transport) {
        return transport.requests().stream().map(RequestDescriptor::target).collect(Collectors.toList());
    }

    // ===== Page-number strategy =====

    @Test
    void testPagination_TotalPagesTwo_IssuesTwoRequestsInOrder() {
        // Given
        transport.respond(200, numberedPage(List.of("a"), 1, 1, 2))
            .respond(200, numberedPage(List.of("b"), 2, 1, 2));
        DefaultApiExecutor executor = executor(fastOptions());

        // When
        List<String> items = executor.paginate(PaginationStrategy.pageNumber(1, 1),
                PaginationContractTest::zonesPage, stringPage())
            .stream().collect(Collectors.toList());

        // Then
        assertEquals(List.of("a", "b"), items);
        assertEquals(List.of("zones?page=1&per_page=1", "zones?page=2&per_page=1"), targets(transport));
    }

    @Test
    void testPagination_EmptyPageBeforeTotalPages_ContinuesToLastPage() {
        // Given
        transport.respond(200, numberedPage(List.of("a"), 1, 1, 3))
            .respond(200, numberedPage(List.of(), 2, 1, 3))
            .respond(200, numberedPage(List.of("c"), 3, 1, 3));
        DefaultApiExecutor executor = executor(fastOptions());

        // When
        List<String> items = executor.paginate(PaginationStrategy.pageNumber(1, 1),
                PaginationContractTest::zonesPage, stringPage())
            .stream().collect(Collectors.toList());

        // Then
        assertEquals(List.of("a", "c"), items);
        assertEquals(3, transport.invocationCount());
    }

    @Test
    void testPagination_UnknownTotalPages_StopsOnShortPage() {
        // Given
        transport.respond(200, numberedPage(List.of("a", "b"), 1, 2, 0))
            .respond(200, numberedPage(List.of("c"), 2, 2, 0))
            .respond(200, numberedPage(List.of("never"), 3, 2, 0));
        DefaultApiExecutor executor = executor(fastOptions());

        // When
        List<String> items = executor.paginate(PaginationStrategy.pageNumber(1, 2),
                PaginationContractTest::zonesPage, stringPage())
            .stream().collect(Collectors.toList());

        // Then
        assertEquals(List.of("a", "b", "c"), items);
        assertEquals(2, transport.invocationCount());
    }

    @Test
    void testPagination_UnknownTotalPages_StopsOnEmptyPage() {
        // Given
        transport.respond(200, numberedPage(List.of("a", "b"), 1, 2, 0))
            .respond(200, numberedPage(List.of(), 2, 2, 0))
            .respond(200, numberedPage(List.of("never"), 3, 2, 0));
        DefaultApiExecutor executor = executor(fastOptions());

        // When
        List<String> items = executor.paginate(PaginationStrategy.pageNumber(1, 2),
                PaginationContractTest::zonesPage, stringPage())
            .stream().collect(Collectors.toList());

        // Then
        assertEquals(List.of("a", "b"), items);
        assertEquals(2, transport.invocationCount());
    }

    @Test
    void testPagination_LazyFetch_OnlyFetchesWhenConsumerAdvances() {
        // Given
        transport.respond(200, numberedPage(List.of("a", "b"), 1, 2, 3))
            .respond(200, numberedPage(List.of("c", "d"), 2, 2, 3));
        DefaultApiExecutor executor = executor(fastOptions());
        PagedIterable<String> pages = executor.paginate(PaginationStrategy.pageNumber(1, 2),
            PaginationContractTest::zonesPage, stringPage());

        // When / Then
        assertEquals(0, transport.invocationCount(), "Nothing is fetched before iteration");
        Iterator<String> iterator = pages.iterator();
        assertEquals("a", iterator.next());
        assertEquals("b", iterator.next());
        assertEquals(1, transport.invocationCount());
        assertEquals("c", iterator.next());
        assertEquals(2, transport.invocationCount());
    }

    @Test
    void testPagination_SecondIteration_IsRejected() {
        // Given
        transport.respond(200, numberedPage(List.of("a"), 1, 1, 1));
        PagedIterable<String> pages = executor(fastOptions()).paginate(PaginationStrategy.pageNumber(),
            PaginationContractTest::zonesPage, stringPage());
        pages.iterator();

        // When / Then
        assertThrows(IllegalStateException.class, pages::iterator);
    }

    // ===== Cursor strategy =====

    @Test
    void testPagination_Cursor_FollowsCursorsAndPreservesFilters() {
        // Given
        transport.respond(200, cursorPage(List.of("a"), "c1"))
            .respond(200, cursorPage(List.of("b"), "c2"))
            .respond(200, cursorPage(List.of("c"), null));
        DefaultApiExecutor executor = executor(fastOptions());

        // When
        List<String> items = executor.paginate(PaginationStrategy.cursor(),
                PaginationContractTest::bucketsPage, stringCursorPage())
            .stream().collect(Collectors.toList());

        // Then
        assertEquals(List.of("a", "b", "c"), items);
        assertEquals(List.of(
            "buckets?prefix=logs&limit=1",
            "buckets?prefix=logs&limit=1&cursor=c1",
            "buckets?prefix=logs&limit=1&cursor=c2"), targets(transport));
    }

    // ===== Failures and cancellation =====

    @Test
    void testPagination_IntermediatePageFailure_KeepsYieldedItems() {
        // Given
        transport.respond(200, numberedPage(List.of("a", "b"), 1, 2, 3))
            .respond(200, failureEnvelope(new ApiError(1003, "page unavailable")));
        PagedIterable<String> pages = executor(fastOptions()).paginate(PaginationStrategy.pageNumber(1, 2),
            PaginationContractTest::zonesPage, stringPage());
        List<String> seen = new ArrayList<>();

        // When
        ApiPaginationException exception = assertThrows(ApiPaginationException.class, () -> {
            for (String item : pages) {
                seen.add(item);
            }
        });

        // Then
        assertEquals(List.of("a", "b"), seen);
        assertEquals(2, exception.getPageNumber());
        assertEquals(2, exception.getYieldedItems());
        assertTrue(exception.getOutcome() instanceof ApplicationFailure);
    }

    @Test
    void testPagination_CancelledBetweenPages_StartsNoFurtherFetch() {
        // Given
        transport.respond(200, numberedPage(List.of("a"), 1, 1, 2))
            .respond(200, numberedPage(List.of("b"), 2, 1, 2));
        CancellationToken token = CancellationToken.create();
        Iterator<String> iterator = executor(fastOptions()).paginate(PaginationStrategy.pageNumber(1, 1),
            PaginationContractTest::zonesPage, stringPage(), token).iterator();
        assertEquals("a", iterator.next());

        // When
        token.cancel("caller stopped");

        // Then
        ApiPaginationException exception = assertThrows(ApiPaginationException.class, iterator::hasNext);
        assertTransportFailure(exception.getOutcome(), FailureKind.CANCELLED);
        assertEquals(1, exception.getYieldedItems());
        assertEquals(1, transport.invocationCount());
    }
}
