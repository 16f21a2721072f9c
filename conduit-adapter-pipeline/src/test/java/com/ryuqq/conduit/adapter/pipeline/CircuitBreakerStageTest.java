package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.classify.FailureClassifier;
import com.ryuqq.conduit.core.exception.ApiTransportException;
import com.ryuqq.conduit.core.model.ApiError;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import com.ryuqq.conduit.core.protection.CircuitBreaker;
import com.ryuqq.conduit.core.protection.CircuitBreakerState;
import com.ryuqq.conduit.core.protection.CircuitPermit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * CircuitBreakerStage 테스트.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CircuitBreakerStageTest {

    private static final RequestDescriptor REQUEST = RequestDescriptor.get("zones");
    private static final CircuitPermit PERMIT = new CircuitPermit(REQUEST, 7L);

    @Mock
    private CircuitBreaker circuitBreaker;

    private CircuitBreakerStage stage;

    @BeforeEach
    void setUp() {
        stage = new CircuitBreakerStage(circuitBreaker, new FailureClassifier(true), Clock.systemUTC());
    }

    private static <T> PipelineCall<T> returning(PipelineOutcome<T> outcome) {
        return token -> CompletableFuture.completedFuture(outcome);
    }

    @Test
    void 차단되면_안쪽을_호출하지_않고_CIRCUIT_OPEN() {
        // given
        when(circuitBreaker.tryAcquire(REQUEST)).thenReturn(Optional.empty());
        when(circuitBreaker.getName()).thenReturn("zones");
        when(circuitBreaker.getState()).thenReturn(CircuitBreakerState.OPEN);
        AtomicInteger calls = new AtomicInteger();

        // when
        PipelineOutcome<String> outcome = stage.execute(REQUEST, token -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(PipelineOutcome.success("x"));
        }, CancellationToken.none()).join();

        // then
        assertThat(calls).hasValue(0);
        assertThat(((TransportFailure<String>) outcome).kind()).isEqualTo(FailureKind.CIRCUIT_OPEN);
        assertThat(((TransportFailure<String>) outcome).detail()).contains("zones");
    }

    @Test
    void 성공은_성공으로_기록() {
        when(circuitBreaker.tryAcquire(REQUEST)).thenReturn(Optional.of(PERMIT));

        stage.execute(REQUEST, returning(PipelineOutcome.success("ok")), CancellationToken.none()).join();

        verify(circuitBreaker).recordSuccess(eq(PERMIT), any(Duration.class));
        verify(circuitBreaker, never()).recordFailure(any(), any(), any());
    }

    @Test
    void 서버_오류는_실패로_기록() {
        when(circuitBreaker.tryAcquire(REQUEST)).thenReturn(Optional.of(PERMIT));

        stage.execute(REQUEST, returning(TransportFailure.<String>httpStatus(503, "down")), CancellationToken.none())
            .join();

        verify(circuitBreaker).recordFailure(eq(PERMIT), any(Duration.class), any(ApiTransportException.class));
    }

    @Test
    void 연결_실패도_실패로_기록() {
        when(circuitBreaker.tryAcquire(REQUEST)).thenReturn(Optional.of(PERMIT));

        stage.execute(REQUEST, returning(TransportFailure.<String>connection(new IOException("reset"))),
            CancellationToken.none()).join();

        verify(circuitBreaker).recordFailure(eq(PERMIT), any(Duration.class), any(ApiTransportException.class));
    }

    @Test
    void 클라이언트_오류와_애플리케이션_실패는_성공으로_기록() {
        when(circuitBreaker.tryAcquire(REQUEST)).thenReturn(Optional.of(PERMIT));

        stage.execute(REQUEST, returning(TransportFailure.<String>httpStatus(404, "missing")), CancellationToken.none())
            .join();
        stage.execute(REQUEST, returning(PipelineOutcome.<String>applicationFailure(
            List.of(new ApiError(1001, "bad")), List.of())), CancellationToken.none()).join();

        verify(circuitBreaker, org.mockito.Mockito.times(2)).recordSuccess(eq(PERMIT), any(Duration.class));
        verify(circuitBreaker, never()).recordFailure(any(), any(), any());
    }

    @Test
    void 취소는_기록하지_않고_permit만_반납() {
        when(circuitBreaker.tryAcquire(REQUEST)).thenReturn(Optional.of(PERMIT));

        stage.execute(REQUEST, returning(TransportFailure.<String>cancelled("user")), CancellationToken.none()).join();

        verify(circuitBreaker).releasePermission(PERMIT);
        verify(circuitBreaker, never()).recordSuccess(any(), any());
        verify(circuitBreaker, never()).recordFailure(any(), any(), any());
    }
}
