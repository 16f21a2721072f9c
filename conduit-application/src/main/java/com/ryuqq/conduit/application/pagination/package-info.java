/**
 * Pagination engine.
 *
 * <p>Two interchangeable strategies walk page-number and opaque-cursor endpoints
 * through a caller-supplied request builder and yield items lazily.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.application.pagination.PaginationStrategy} - strategy contract and factories</li>
 *   <li>{@link com.ryuqq.conduit.application.pagination.PageNumberStrategy} - page / totalPages with full-page fallback</li>
 *   <li>{@link com.ryuqq.conduit.application.pagination.CursorStrategy} - continue while the cursor is non-empty</li>
 *   <li>{@link com.ryuqq.conduit.application.pagination.PagedIterable} - lazy, forward-only, single-use sequence</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conduit Team
 */
package com.ryuqq.conduit.application.pagination;
