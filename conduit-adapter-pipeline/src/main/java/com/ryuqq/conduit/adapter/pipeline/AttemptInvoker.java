package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.decode.ResponseDecoder;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import com.ryuqq.conduit.core.quota.RateLimitHeaders;
import com.ryuqq.conduit.core.quota.RetryAfter;
import com.ryuqq.conduit.core.spi.HttpTransport;
import com.ryuqq.conduit.core.spi.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP 시도 하나 (파이프라인의 가장 안쪽 호출).
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>{@link HttpTransport#send} 호출</li>
 *   <li>transport 예외 → CONNECTION (토큰이 취소된 상태면 CANCELLED)</li>
 *   <li>{@link IllegalArgumentException} → INVALID_REQUEST (재시도하지 않음)</li>
 *   <li>응답의 rate-limit 헤더로 {@link QuotaTracker} 갱신</li>
 *   <li>디코더 실행, 디코더 예외 → MALFORMED_RESPONSE</li>
 *   <li>HTTP_STATUS 실패에 Retry-After 값 첨부</li>
 * </ol>
 *
 * @param <T> 결과 타입
 * @author Conduit Team
 * @since 1.0.0
 */
final class AttemptInvoker<T> implements PipelineCall<T> {

    private static final Logger log = LoggerFactory.getLogger(AttemptInvoker.class);

    private final RequestDescriptor request;
    private final ResponseDecoder<T> decoder;
    private final HttpTransport transport;
    private final QuotaTracker quotaTracker;
    private final Clock clock;

    AttemptInvoker(RequestDescriptor request, ResponseDecoder<T> decoder, HttpTransport transport,
                   QuotaTracker quotaTracker, Clock clock) {
        this.request = request;
        this.decoder = decoder;
        this.transport = transport;
        this.quotaTracker = quotaTracker;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<PipelineOutcome<T>> invoke(CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.completedFuture(TransportFailure.cancelled(token.reason()));
        }

        CompletableFuture<TransportResponse> sent;
        try {
            sent = transport.send(request, token);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }

        return sent.handle((response, error) -> error != null
            ? onTransportError(Stages.unwrap(error), token)
            : onResponse(response));
    }

    private PipelineOutcome<T> onTransportError(Throwable error, CancellationToken token) {
        if (token.isCancelled()) {
            log.debug("{} {} aborted: {}", request.verb(), request.target(), token.reason());
            return TransportFailure.cancelled(token.reason());
        }
        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid request {} {}: {}", request.verb(), request.target(), error.getMessage());
            return TransportFailure.invalidRequest(error);
        }
        log.debug("Transport failure for {} {}: {}", request.verb(), request.target(), error.toString());
        return TransportFailure.connection(error);
    }

    private PipelineOutcome<T> onResponse(TransportResponse response) {
        if (response == null) {
            return TransportFailure.connection(new IllegalStateException("transport returned no response"));
        }
        RateLimitHeaders.parse(response, clock.instant()).ifPresent(quotaTracker::record);

        PipelineOutcome<T> outcome;
        try {
            outcome = decoder.decode(response.body(), response.statusCode());
        } catch (RuntimeException e) {
            log.warn("Failed to decode response for {} {} (HTTP {})",
                request.verb(), request.target(), response.statusCode(), e);
            return TransportFailure.malformed(response.statusCode(), e, "response decoding failed: " + e.getMessage());
        }
        if (outcome == null) {
            return TransportFailure.malformed(response.statusCode(), null, "decoder returned no outcome");
        }

        if (outcome instanceof TransportFailure<T> failure
            && failure.kind() == FailureKind.HTTP_STATUS
            && failure.retryAfter() == null) {
            Optional<Duration> retryAfter = response.firstHeader(RetryAfter.HEADER)
                .flatMap(value -> RetryAfter.parse(value, clock.instant()));
            if (retryAfter.isPresent()) {
                return failure.withRetryAfter(retryAfter.get());
            }
        }
        return outcome;
    }
}
