package com.ryuqq.conduit.adapter.jdkhttp;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.HttpVerb;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.spi.TransportResponse;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JdkHttpTransport 테스트 (로컬 HttpServer 사용).
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class JdkHttpTransportTest {

    private HttpServer server;
    private JdkHttpTransport transport;
    private final AtomicReference<String> lastMethod = new AtomicReference<>();
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/client/v4/zones", exchange -> {
            lastMethod.set(exchange.getRequestMethod());
            lastPath.set(exchange.getRequestURI().toString());
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = "{\"success\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("X-RateLimit-Remaining", "42");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/client/v4/slow", exchange -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();

        URI baseUri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/client/v4");
        transport = JdkHttpTransport.withBearerToken(HttpClient.newHttpClient(), baseUri, "secret-token");
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        server.stop(0);
    }

    @Test
    void 기본_URI와_인증_헤더로_요청() throws Exception {
        TransportResponse response = transport.send(RequestDescriptor.get("zones?page=2"), CancellationToken.none())
            .get(5, TimeUnit.SECONDS);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(new String(response.body(), StandardCharsets.UTF_8)).isEqualTo("{\"success\":true}");
        assertThat(response.firstHeader("x-ratelimit-remaining")).contains("42");
        assertThat(lastMethod.get()).isEqualTo("GET");
        assertThat(lastPath.get()).isEqualTo("/client/v4/zones?page=2");
        assertThat(lastAuth.get()).isEqualTo("Bearer secret-token");
    }

    @Test
    void 본문과_메서드를_그대로_전송() throws Exception {
        transport.send(RequestDescriptor.json(HttpVerb.PATCH, "/zones", "{\"paused\":true}".getBytes(StandardCharsets.UTF_8)),
            CancellationToken.none()).get(5, TimeUnit.SECONDS);

        assertThat(lastMethod.get()).isEqualTo("PATCH");
        assertThat(lastBody.get()).isEqualTo("{\"paused\":true}");
    }

    @Test
    void 토큰이_취소되면_진행_중인_교환을_중단() {
        CancellationToken token = CancellationToken.create();

        CompletableFuture<TransportResponse> future = transport.send(RequestDescriptor.get("slow"), token);
        token.cancel("attempt timed out");

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(CancellationException.class);
    }

    @Test
    void 대상_경로_결합() {
        JdkHttpTransport withSlash = new JdkHttpTransport(HttpClient.newHttpClient(),
            URI.create("https://api.example.com/client/v4/"), Map.of());

        assertThat(withSlash.resolve("/zones")).isEqualTo(URI.create("https://api.example.com/client/v4/zones"));
        assertThat(withSlash.resolve("zones")).isEqualTo(URI.create("https://api.example.com/client/v4/zones"));
        assertThat(transport.resolve("https://other.example.com/x")).isEqualTo(URI.create("https://other.example.com/x"));
    }

    @Test
    void URI로_해석할_수_없는_대상은_예외를_던지지_않고_실패한_future() {
        CompletableFuture<TransportResponse> future =
            transport.send(RequestDescriptor.get("zones?name=a b"), CancellationToken.none());

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(lastPath.get()).isNull();
    }

    @Test
    void 허용되지_않는_헤더는_실패한_future() {
        CompletableFuture<TransportResponse> future =
            transport.send(RequestDescriptor.get("zones").withHeader("Connection", "close"), CancellationToken.none());

        assertThat(future).isCompletedExceptionally();
        assertThatThrownBy(future::join).hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 상대_baseUri는_거부() {
        assertThatThrownBy(() -> new JdkHttpTransport(HttpClient.newHttpClient(), URI.create("/relative"), Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("baseUri");
    }
}
