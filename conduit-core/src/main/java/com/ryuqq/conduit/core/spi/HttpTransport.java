package com.ryuqq.conduit.core.spi;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.RequestDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * HTTP Transport SPI.
 *
 * <p>요청 하나를 물리적으로 한 번 전송합니다. 재시도, 타임아웃, 동시성 제한은
 * 파이프라인이 담당하므로 구현체는 이를 직접 처리하지 않습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>호출 스레드를 블로킹하지 않고 {@link CompletableFuture}를 반환</li>
 *   <li>{@code token}이 취소되면 진행 중인 교환을 중단</li>
 *   <li>HTTP 상태 코드와 상관없이 응답을 받으면 정상 완료 (4xx, 5xx 포함)</li>
 *   <li>연결 실패 등은 예외로 완료</li>
 *   <li>요청 자체를 만들 수 없으면 (잘못된 URI, 허용되지 않는 헤더) {@link IllegalArgumentException}으로 완료.
 *       파이프라인은 이를 재시도하지 않는 INVALID_REQUEST로 분류</li>
 *   <li>base URI, 인증 헤더 등 단일 업스트림에 대한 정보는 구현체가 보유</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public interface HttpTransport {

    /**
     * 요청 전송.
     *
     * @param request 요청 기술자
     * @param token 이 시도의 취소 토큰
     * @return 응답 future
     */
    CompletableFuture<TransportResponse> send(RequestDescriptor request, CancellationToken token);
}
