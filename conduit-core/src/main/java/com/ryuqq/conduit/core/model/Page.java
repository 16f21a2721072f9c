package com.ryuqq.conduit.core.model;

import java.util.List;

/**
 * 한 페이지 분량의 결과.
 *
 * @param items 항목 목록
 * @param pagination 페이지네이션 메타데이터 (서버가 보내지 않으면 null)
 * @param <T> 항목 타입
 * @author Conduit Team
 * @since 1.0.0
 */
public record Page<T>(List<T> items, Pagination pagination) {

    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
