package com.ryuqq.conduit.testkit.contract;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.spi.HttpTransport;
import com.ryuqq.conduit.core.spi.TransportResponse;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Scripted HttpTransport for Contract Tests.
 *
 * <p>Each {@link #send} call consumes the next scripted step. When the script runs out,
 * the last step is repeated, so a single {@code respond(500, ...)} models a permanently
 * failing upstream.</p>
 *
 * <p><strong>Recorded data:</strong></p>
 * <ul>
 *   <li>every {@link RequestDescriptor} sent, in order</li>
 *   <li>the attempt token of every invocation (to check cancellation reached the transport)</li>
 *   <li>the {@link System#nanoTime()} of every invocation (to measure retry delays)</li>
 * </ul>
 *
 * <p>Thread-safe: invocations may arrive from pipeline scheduler threads.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class ScriptedTransport implements HttpTransport {

    private final Queue<Function<CancellationToken, CompletableFuture<TransportResponse>>> script =
        new ConcurrentLinkedQueue<>();
    private final List<RequestDescriptor> requests = new CopyOnWriteArrayList<>();
    private final List<CancellationToken> tokens = new CopyOnWriteArrayList<>();
    private final List<Long> invocationNanos = new CopyOnWriteArrayList<>();
    private volatile Function<CancellationToken, CompletableFuture<TransportResponse>> last;

    /**
     * Scripts a completed response.
     *
     * @param status HTTP status code
     * @param body response body (UTF-8)
     * @return this transport
     */
    public ScriptedTransport respond(int status, String body) {
        return respond(TransportResponse.of(status, body));
    }

    /**
     * Scripts a completed response with headers (e.g. Retry-After).
     *
     * @param status HTTP status code
     * @param headers response headers
     * @param body response body (UTF-8)
     * @return this transport
     */
    public ScriptedTransport respond(int status, Map<String, List<String>> headers, String body) {
        return respond(new TransportResponse(status, headers, body.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Scripts a completed response.
     *
     * @param response the response
     * @return this transport
     */
    public ScriptedTransport respond(TransportResponse response) {
        return then(token -> CompletableFuture.completedFuture(response));
    }

    /**
     * Scripts a transport-level exception (connection refused, DNS failure, ...).
     *
     * @param error the failure
     * @return this transport
     */
    public ScriptedTransport fail(Throwable error) {
        return then(token -> CompletableFuture.failedFuture(error));
    }

    /**
     * Scripts a response that arrives after a real delay, unless the attempt is cancelled first.
     *
     * @param delay delay before responding
     * @param status HTTP status code
     * @param body response body
     * @return this transport
     */
    public ScriptedTransport respondAfter(Duration delay, int status, String body) {
        return then(token -> {
            CompletableFuture<TransportResponse> future = new CompletableFuture<TransportResponse>()
                .completeOnTimeout(TransportResponse.of(status, body), delay.toMillis(), TimeUnit.MILLISECONDS);
            token.onCancel(() -> future.cancel(true));
            return future;
        });
    }

    /**
     * Scripts an attempt that never answers; it only ends when its token is cancelled.
     *
     * @return this transport
     */
    public ScriptedTransport hang() {
        return then(token -> {
            CompletableFuture<TransportResponse> future = new CompletableFuture<>();
            token.onCancel(() -> future.cancel(true));
            return future;
        });
    }

    /**
     * Scripts an attempt answered by a future the test completes manually.
     *
     * <p>Useful for holding a permit or a half-open trial call in flight.</p>
     *
     * @param pending future completed by the test
     * @return this transport
     */
    public ScriptedTransport respondWith(CompletableFuture<TransportResponse> pending) {
        return then(token -> {
            token.onCancel(() -> pending.cancel(true));
            return pending;
        });
    }

    /**
     * Appends a custom step.
     *
     * @param step function from the attempt token to the response future
     * @return this transport
     */
    public ScriptedTransport then(Function<CancellationToken, CompletableFuture<TransportResponse>> step) {
        script.add(step);
        last = step;
        return this;
    }

    @Override
    public CompletableFuture<TransportResponse> send(RequestDescriptor request, CancellationToken token) {
        requests.add(request);
        tokens.add(token);
        invocationNanos.add(System.nanoTime());
        Function<CancellationToken, CompletableFuture<TransportResponse>> step = script.poll();
        if (step == null) {
            step = last;
        }
        if (step == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No scripted response for " + request));
        }
        return step.apply(token);
    }

    /**
     * @return number of times the transport was invoked
     */
    public int invocationCount() {
        return requests.size();
    }

    /**
     * @return every request sent, in order
     */
    public List<RequestDescriptor> requests() {
        return List.copyOf(requests);
    }

    /**
     * @return number of invocations whose attempt token was cancelled
     */
    public long cancelledInvocations() {
        return tokens.stream().filter(CancellationToken::isCancelled).count();
    }

    /**
     * Gaps between consecutive invocations.
     *
     * @return inter-attempt delays, one fewer than the invocation count
     */
    public List<Duration> interAttemptDelays() {
        List<Long> snapshot = new ArrayList<>(invocationNanos);
        List<Duration> gaps = new ArrayList<>();
        for (int i = 1; i < snapshot.size(); i++) {
            gaps.add(Duration.ofNanos(snapshot.get(i) - snapshot.get(i - 1)));
        }
        return gaps;
    }

    /**
     * Waits until at least {@code expected} invocations happened.
     *
     * @param expected invocation count to wait for
     * @param timeout maximum wait
     * @return true if reached within the timeout
     */
    public boolean awaitInvocations(int expected, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (requests.size() < expected) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }
}
