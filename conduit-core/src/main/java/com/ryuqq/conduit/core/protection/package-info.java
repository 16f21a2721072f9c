/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>Resilience Pipeline이 사용하는 보호 메커니즘의 확장점을 정의합니다.</p>
 *
 * <h2>파이프라인 내 위치</h2>
 *
 * <pre>
 * Total Timeout
 *   └─ Rate Limiter   → {@link com.ryuqq.conduit.core.protection.Bulkhead} + 선제 지연
 *        └─ Circuit Breaker → {@link com.ryuqq.conduit.core.protection.CircuitBreaker}
 *             └─ Retry
 *                  └─ Attempt Timeout
 *                       └─ Transport
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지는 보호 없이 항상 허용하는 기본 구현을 제공합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@code conduit-adapter-pipeline}: RollingWindowCircuitBreaker, QueueingBulkhead</li>
 *   <li>{@code conduit-adapter-resilience4j}: Resilience4jCircuitBreaker</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 * @see com.ryuqq.conduit.core.protection.CircuitBreaker
 * @see com.ryuqq.conduit.core.protection.Bulkhead
 * @see com.ryuqq.conduit.core.protection.noop
 */
package com.ryuqq.conduit.core.protection;
