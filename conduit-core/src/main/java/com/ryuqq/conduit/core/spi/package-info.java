/**
 * 외부 시스템 연결 SPI (Service Provider Interface).
 *
 * <ul>
 *   <li>{@link com.ryuqq.conduit.core.spi.HttpTransport}: 단일 HTTP 교환</li>
 *   <li>{@link com.ryuqq.conduit.core.spi.TransportResponse}: 원시 응답</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
package com.ryuqq.conduit.core.spi;
