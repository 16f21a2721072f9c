package com.ryuqq.conduit.core.quota;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * {@code Retry-After} 헤더 파서.
 *
 * <p>delta-seconds ({@code 120})와 HTTP-date ({@code Wed, 21 Oct 2015 07:28:00 GMT})
 * 두 형식을 지원합니다. 해석할 수 없는 값은 없는 것으로 취급합니다.
 * 이미 지난 날짜는 0으로 계산합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class RetryAfter {

    public static final String HEADER = "Retry-After";

    /**
     * 해석 가능한 최대 대기 시간. 나노초로 표현 가능한 범위 (약 292년)를 넘는 값은 없는 것으로 취급합니다.
     */
    public static final long MAX_DELAY_SECONDS = Long.MAX_VALUE / 1_000_000_000L;

    private RetryAfter() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Retry-After 값 해석.
     *
     * @param value 헤더 값 (null 가능)
     * @param now 현재 시각
     * @return 대기 시간 (해석 불가 시 empty)
     */
    public static Optional<Duration> parse(String value, Instant now) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        Optional<Duration> seconds = parseDeltaSeconds(trimmed);
        if (seconds.isPresent()) {
            return seconds;
        }
        return parseHttpDate(trimmed)
            .map(date -> Duration.between(now, date))
            .map(delay -> delay.isNegative() ? Duration.ZERO : delay)
            .filter(delay -> delay.getSeconds() <= MAX_DELAY_SECONDS);
    }

    private static Optional<Duration> parseDeltaSeconds(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return Optional.empty();
            }
        }
        try {
            long seconds = Long.parseLong(value);
            if (seconds > MAX_DELAY_SECONDS) {
                return Optional.empty();
            }
            return Optional.of(Duration.ofSeconds(seconds));
        } catch (NumberFormatException e) {
            // 자릿수 초과
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseHttpDate(String value) {
        try {
            return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
