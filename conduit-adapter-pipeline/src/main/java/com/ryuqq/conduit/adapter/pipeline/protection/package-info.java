/**
 * Protection SPI 기본 구현체.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.adapter.pipeline.protection.RollingWindowCircuitBreaker} - 시간 구간 실패율 breaker</li>
 *   <li>{@link com.ryuqq.conduit.adapter.pipeline.protection.QueueingBulkhead} - FIFO 대기열 동시성 제한</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.pipeline.protection;
