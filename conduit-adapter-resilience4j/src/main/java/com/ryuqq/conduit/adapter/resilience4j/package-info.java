/**
 * Resilience4j 기반 Circuit Breaker 구현체.
 *
 * @since 1.0.0
 */
package com.ryuqq.conduit.adapter.resilience4j;
