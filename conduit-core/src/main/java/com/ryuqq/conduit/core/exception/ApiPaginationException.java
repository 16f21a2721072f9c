package com.ryuqq.conduit.core.exception;

import com.ryuqq.conduit.core.outcome.ApplicationFailure;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;

/**
 * 페이지네이션 도중 페이지 요청이 실패했음을 알리는 예외.
 *
 * <p>이미 소비자에게 전달한 항목은 그대로 유효합니다.
 * 실패한 페이지의 원래 결과는 {@link #getOutcome()}으로 조회합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class ApiPaginationException extends ConduitException {

    private final PipelineOutcome<?> outcome;
    private final int pageNumber;
    private final long yieldedItems;

    public ApiPaginationException(PipelineOutcome<?> outcome, int pageNumber, long yieldedItems) {
        super("Pagination stopped at page " + pageNumber + " after " + yieldedItems + " items: "
            + describe(outcome), causeOf(outcome));
        this.outcome = outcome;
        this.pageNumber = pageNumber;
        this.yieldedItems = yieldedItems;
    }

    private static String describe(PipelineOutcome<?> outcome) {
        if (outcome instanceof ApplicationFailure<?> failure) {
            return failure.describe();
        }
        if (outcome instanceof TransportFailure<?> failure) {
            return failure.kind() + " " + failure.detail();
        }
        return String.valueOf(outcome);
    }

    private static Throwable causeOf(PipelineOutcome<?> outcome) {
        if (outcome instanceof ApplicationFailure<?> failure) {
            return failure.toException();
        }
        if (outcome instanceof TransportFailure<?> failure) {
            return failure.toException();
        }
        return null;
    }

    public PipelineOutcome<?> getOutcome() {
        return outcome;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public long getYieldedItems() {
        return yieldedItems;
    }
}
