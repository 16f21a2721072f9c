/**
 * 요청 실행 진입점.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.conduit.application.executor.ApiExecutor} - execute / paginate 진입점 인터페이스</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-pipeline 모듈의 {@code DefaultApiExecutor}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.conduit.application.executor;
