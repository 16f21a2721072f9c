package com.ryuqq.conduit.adapter.pipeline;

import com.ryuqq.conduit.adapter.pipeline.protection.QueueingBulkhead;
import com.ryuqq.conduit.adapter.pipeline.protection.RollingWindowCircuitBreaker;
import com.ryuqq.conduit.core.cancel.CancellationToken;
import com.ryuqq.conduit.core.classify.FailureClassifier;
import com.ryuqq.conduit.core.config.PipelineOptions;
import com.ryuqq.conduit.core.decode.ResponseDecoder;
import com.ryuqq.conduit.core.model.RequestDescriptor;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.protection.Bulkhead;
import com.ryuqq.conduit.core.protection.BulkheadConfig;
import com.ryuqq.conduit.core.protection.CircuitBreaker;
import com.ryuqq.conduit.core.spi.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.DoubleSupplier;

/**
 * Resilience Pipeline.
 *
 * <p>설정된 클라이언트 하나가 소유하는 stage 조합입니다. breaker, bulkhead, 할당량 상태는
 * 이 인스턴스에만 속하므로 같은 프로세스의 다른 클라이언트와 공유되지 않습니다.</p>
 *
 * <p><strong>stage 순서 (안쪽 → 바깥쪽):</strong></p>
 * <pre>
 * HTTP 시도
 *   ↑ AttemptTimeoutStage   시도 하나의 상한
 *   ↑ RetryStage            분류기 기준 재시도, 백오프 / Retry-After
 *   ↑ CircuitBreakerStage   논리적 호출 단위 실패율 추적
 *   ↑ RateLimiterStage      선제 스로틀 + 동시성 제한 / 대기열
 *   ↑ TotalTimeoutStage     논리적 작업 전체 상한
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * ResiliencePipeline pipeline = ResiliencePipeline.builder()
 *     .name("dns")
 *     .options(new PipelineOptions().withMaxRetries(3))
 *     .transport(new JdkHttpTransport(httpClient, baseUri, headers))
 *     .build();
 * }</pre>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class ResiliencePipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResiliencePipeline.class);

    private final String name;
    private final PipelineOptions options;
    private final HttpTransport transport;
    private final CircuitBreaker circuitBreaker;
    private final Bulkhead bulkhead;
    private final QuotaTracker quotaTracker;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final List<PipelineStage> stages;

    private ResiliencePipeline(Builder builder) {
        this.name = builder.name;
        this.options = builder.options;
        this.transport = builder.transport;
        this.clock = builder.clock;
        this.ownsScheduler = builder.scheduler == null;
        this.scheduler = ownsScheduler ? newScheduler(name) : builder.scheduler;
        this.circuitBreaker = builder.circuitBreaker != null
            ? builder.circuitBreaker
            : RollingWindowCircuitBreaker.of(name, options, clock);
        this.bulkhead = builder.bulkhead != null
            ? builder.bulkhead
            : new QueueingBulkhead(new BulkheadConfig(options.permitLimit(), options.queueLimit()));
        this.quotaTracker = new QuotaTracker();

        FailureClassifier classifier = new FailureClassifier(options.rateLimitRetryEnabled());
        BackoffCalculator backoff = builder.random != null
            ? new BackoffCalculator(options.baseDelay(), options.maxDelay(), options.jitterFactor(), builder.random)
            : new BackoffCalculator(options.baseDelay(), options.maxDelay(), options.jitterFactor());
        ProactiveThrottle throttle = options.proactiveThrottlingEnabled()
            ? new ProactiveThrottle(options.quotaLowThreshold(), options.maxThrottleDelay(), quotaTracker, clock)
            : null;

        this.stages = List.of(
            new AttemptTimeoutStage(options.attemptTimeout(), scheduler),
            new RetryStage(options.maxAttempts(), classifier, backoff, scheduler, clock),
            new CircuitBreakerStage(circuitBreaker, classifier, clock),
            new RateLimiterStage(bulkhead, throttle, scheduler),
            new TotalTimeoutStage(options.totalTimeout(), scheduler)
        );

        log.info("Resilience pipeline {} created (maxAttempts={}, permitLimit={}, queueLimit={}, totalTimeout={})",
            name, options.maxAttempts(), options.permitLimit(), options.queueLimit(), options.totalTimeout());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 논리적 작업 하나 실행.
     *
     * <p>stage를 안쪽부터 감싸 체인을 만들고 가장 바깥 stage부터 실행합니다.</p>
     *
     * @param request 요청
     * @param decoder 응답 디코더
     * @param token 호출자 취소 토큰
     * @param <T> 결과 타입
     * @return 분류된 결과 future
     */
    public <T> CompletableFuture<PipelineOutcome<T>> execute(RequestDescriptor request, ResponseDecoder<T> decoder,
                                                             CancellationToken token) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (decoder == null) {
            throw new IllegalArgumentException("decoder cannot be null");
        }
        CancellationToken callerToken = token == null ? CancellationToken.none() : token;

        PipelineCall<T> call = new AttemptInvoker<>(request, decoder, transport, quotaTracker, clock);
        for (PipelineStage stage : stages) {
            PipelineCall<T> inner = call;
            call = t -> stage.execute(request, inner, t);
        }
        return Stages.invoke(call, callerToken);
    }

    /**
     * 파이프라인 종료. 직접 만든 스케줄러만 종료합니다.
     */
    @Override
    public void close() {
        if (!ownsScheduler) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Resilience pipeline {} scheduler did not terminate in time", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Resilience pipeline {} closed", name);
    }

    public String getName() {
        return name;
    }

    public PipelineOptions getOptions() {
        return options;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Bulkhead getBulkhead() {
        return bulkhead;
    }

    public QuotaTracker getQuotaTracker() {
        return quotaTracker;
    }

    private static ScheduledExecutorService newScheduler(String name) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "conduit-" + name + "-scheduler-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newScheduledThreadPool(1, factory);
    }

    /**
     * ResiliencePipeline 빌더.
     */
    public static final class Builder {

        private String name = "conduit";
        private PipelineOptions options = new PipelineOptions();
        private HttpTransport transport;
        private CircuitBreaker circuitBreaker;
        private Bulkhead bulkhead;
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService scheduler;
        private DoubleSupplier random;

        private Builder() {
        }

        public Builder name(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
            return this;
        }

        public Builder options(PipelineOptions options) {
            if (options == null) {
                throw new IllegalArgumentException("options cannot be null");
            }
            this.options = options;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * breaker 교체 (기본: {@link RollingWindowCircuitBreaker}).
         */
        public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
            this.circuitBreaker = circuitBreaker;
            return this;
        }

        /**
         * bulkhead 교체 (기본: {@link QueueingBulkhead}).
         */
        public Builder bulkhead(Bulkhead bulkhead) {
            this.bulkhead = bulkhead;
            return this;
        }

        public Builder clock(Clock clock) {
            if (clock == null) {
                throw new IllegalArgumentException("clock cannot be null");
            }
            this.clock = clock;
            return this;
        }

        /**
         * 외부 스케줄러 사용. 이 경우 {@link ResiliencePipeline#close()}는 스케줄러를 종료하지 않습니다.
         */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * jitter 난수 공급자 (테스트용).
         */
        public Builder random(DoubleSupplier random) {
            this.random = random;
            return this;
        }

        public ResiliencePipeline build() {
            if (transport == null) {
                throw new IllegalArgumentException("transport cannot be null");
            }
            return new ResiliencePipeline(this);
        }
    }
}
