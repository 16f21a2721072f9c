package com.ryuqq.conduit.adapter.jdkhttp;

import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.spi.HttpTransport;
import com.ryuqq.conduit.core.spi.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link java.net.http.HttpClient} 기반 {@link HttpTransport}.
 *
 * <p>설정된 클라이언트 하나는 업스트림 호스트 하나({@code baseUri})와 고정 헤더(인증 등)를 가집니다.
 * 요청의 target이 절대 URI면 그대로, 아니면 baseUri 뒤에 붙여 보냅니다.</p>
 *
 * <p>취소 토큰이 발동하면 진행 중인 HTTP 교환을 {@code future.cancel(true)}로 중단합니다.
 * 타임아웃은 파이프라인 stage가 담당하므로 여기서는 설정하지 않습니다.</p>
 *
 * <p>target을 URI로 해석할 수 없거나 헤더가 허용되지 않으면 {@link IllegalArgumentException}으로 실패한
 * future를 반환합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Map<String, String> defaultHeaders;

    /**
     * 생성자.
     *
     * @param httpClient JDK HttpClient
     * @param baseUri 업스트림 기본 URI (예: https://api.example.com/client/v4)
     * @param defaultHeaders 모든 요청에 붙는 헤더 (요청 헤더가 우선)
     */
    public JdkHttpTransport(HttpClient httpClient, URI baseUri, Map<String, String> defaultHeaders) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (baseUri == null || !baseUri.isAbsolute()) {
            throw new IllegalArgumentException("baseUri must be an absolute URI (current: " + baseUri + ")");
        }
        this.httpClient = httpClient;
        this.baseUri = baseUri;
        this.defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
    }

    /**
     * Bearer 토큰 인증 transport 생성.
     */
    public static JdkHttpTransport withBearerToken(HttpClient httpClient, URI baseUri, String apiToken) {
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("apiToken cannot be null or blank");
        }
        return new JdkHttpTransport(httpClient, baseUri, Map.of("Authorization", "Bearer " + apiToken));
    }

    @Override
    public CompletableFuture<TransportResponse> send(RequestDescriptor request, CancellationToken token) {
        HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request);
        } catch (IllegalArgumentException e) {
            log.debug("Cannot build {} {}: {}", request.verb(), request.target(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        CompletableFuture<HttpResponse<byte[]>> exchange =
            httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray());

        CancellationToken.Registration registration = token.onCancel(() -> {
            if (exchange.cancel(true)) {
                log.debug("Cancelled {} {}: {}", request.verb(), httpRequest.uri(), token.reason());
            }
        });

        return exchange
            .whenComplete((response, error) -> registration.remove())
            .thenApply(response -> new TransportResponse(
                response.statusCode(),
                response.headers().map(),
                response.body()
            ));
    }

    HttpRequest toHttpRequest(RequestDescriptor request) {
        HttpRequest.BodyPublisher publisher = request.hasBody()
            ? HttpRequest.BodyPublishers.ofByteArray(request.body())
            : HttpRequest.BodyPublishers.noBody();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(resolve(request.target()))
            .method(request.verb().name(), publisher);

        Map<String, String> headers = new LinkedHashMap<>(defaultHeaders);
        headers.putAll(request.headers());
        headers.forEach(builder::header);
        return builder.build();
    }

    URI resolve(String target) {
        URI targetUri = URI.create(target);
        if (targetUri.isAbsolute()) {
            return targetUri;
        }
        String base = baseUri.toString();
        String separator = base.endsWith("/") || target.startsWith("/") ? "" : "/";
        if (base.endsWith("/") && target.startsWith("/")) {
            return URI.create(base + target.substring(1));
        }
        return URI.create(base + separator + target);
    }

    public URI getBaseUri() {
        return baseUri;
    }
}
