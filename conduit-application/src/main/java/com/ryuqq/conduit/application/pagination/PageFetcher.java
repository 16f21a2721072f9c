package com.ryuqq.conduit.application.pagination;

import com.ryuqq.conduit.core.model.Page;
import com.ryuqq.conduit.core.model.PageState;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;

/**
 * 페이지 상태 하나에 대해 페이지 하나를 가져옵니다.
 *
 * @param <T> 항목 타입
 * @author Conduit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface PageFetcher<T> {

    PipelineOutcome<Page<T>> fetch(PageState state);
}
