package com.ryuqq.conduit.core.quota;

import com.ryuqq.conduit.core.model.QuotaSignal;
import com.ryuqq.conduit.core.spi.TransportResponse;

import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * rate-limit 응답 헤더에서 {@link QuotaSignal}을 추출합니다.
 *
 * <p><strong>지원 형식 (우선순위 순):</strong></p>
 * <ul>
 *   <li>{@code RateLimit-Limit}, {@code RateLimit-Remaining}, {@code RateLimit-Reset}</li>
 *   <li>{@code X-RateLimit-Limit}, {@code X-RateLimit-Remaining}, {@code X-RateLimit-Reset}</li>
 *   <li>구조화된 단일 헤더 {@code RateLimit: limit=100, remaining=10, reset=30}</li>
 * </ul>
 *
 * <p>reset 값은 초 단위 상대 시간입니다. 현재 시각보다 큰 epoch 초로 보이는 값
 * (10억 이상)은 절대 시각으로 해석합니다. 숫자가 아니거나 음수인 값은 무시하며,
 * limit과 remaining이 모두 있어야 신호를 만듭니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class RateLimitHeaders {

    private static final long EPOCH_SECONDS_FLOOR = 1_000_000_000L;

    private RateLimitHeaders() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 응답 헤더에서 쿼터 신호 추출.
     *
     * @param response transport 응답
     * @param now 현재 시각
     * @return 쿼터 신호 (헤더가 없거나 해석 불가 시 empty)
     */
    public static Optional<QuotaSignal> parse(TransportResponse response, Instant now) {
        Optional<QuotaSignal> standard = fromSeparateHeaders(response, "RateLimit-", now);
        if (standard.isPresent()) {
            return standard;
        }
        Optional<QuotaSignal> legacy = fromSeparateHeaders(response, "X-RateLimit-", now);
        if (legacy.isPresent()) {
            return legacy;
        }
        return response.firstHeader("RateLimit").flatMap(value -> fromStructured(value, now));
    }

    private static Optional<QuotaSignal> fromSeparateHeaders(TransportResponse response, String prefix, Instant now) {
        OptionalLong limit = number(response.firstHeader(prefix + "Limit").orElse(null));
        OptionalLong remaining = number(response.firstHeader(prefix + "Remaining").orElse(null));
        if (limit.isEmpty() || remaining.isEmpty()) {
            return Optional.empty();
        }
        OptionalLong reset = number(response.firstHeader(prefix + "Reset").orElse(null));
        return Optional.of(new QuotaSignal(remaining.getAsLong(), limit.getAsLong(), resetAt(reset, now)));
    }

    private static Optional<QuotaSignal> fromStructured(String value, Instant now) {
        OptionalLong limit = OptionalLong.empty();
        OptionalLong remaining = OptionalLong.empty();
        OptionalLong reset = OptionalLong.empty();

        for (String part : value.split("[,;]")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = part.substring(0, eq).trim().toLowerCase();
            String raw = part.substring(eq + 1).trim();
            switch (key) {
                case "limit", "l" -> limit = number(raw);
                case "remaining", "r" -> remaining = number(raw);
                case "reset", "t" -> reset = number(raw);
                default -> {
                    // 알 수 없는 파라미터는 무시
                }
            }
        }

        if (limit.isEmpty() || remaining.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new QuotaSignal(remaining.getAsLong(), limit.getAsLong(), resetAt(reset, now)));
    }

    private static Instant resetAt(OptionalLong reset, Instant now) {
        if (reset.isEmpty()) {
            return now;
        }
        long seconds = reset.getAsLong();
        if (seconds >= EPOCH_SECONDS_FLOOR) {
            return Instant.ofEpochSecond(seconds);
        }
        return now.plusSeconds(seconds);
    }

    private static OptionalLong number(String raw) {
        if (raw == null) {
            return OptionalLong.empty();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("\"") && trimmed.endsWith("\"") && trimmed.length() >= 2) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        try {
            long value = Long.parseLong(trimmed);
            return value < 0 ? OptionalLong.empty() : OptionalLong.of(value);
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
