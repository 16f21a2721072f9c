package com.ryuqq.conduit.core.quota;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RetryAfter 파서 테스트.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class RetryAfterTest {

    private static final Instant NOW = Instant.parse("2015-10-21T07:28:00Z");

    @Test
    void delta_seconds_형식() {
        assertThat(RetryAfter.parse("120", NOW)).contains(Duration.ofSeconds(120));
        assertThat(RetryAfter.parse(" 0 ", NOW)).contains(Duration.ZERO);
    }

    @Test
    void HTTP_date_형식() {
        assertThat(RetryAfter.parse("Wed, 21 Oct 2015 07:28:30 GMT", NOW)).contains(Duration.ofSeconds(30));
    }

    @Test
    void 지난_날짜는_0() {
        assertThat(RetryAfter.parse("Wed, 21 Oct 2015 07:27:00 GMT", NOW)).contains(Duration.ZERO);
    }

    @Test
    void 해석할_수_없는_값은_없는_것으로_취급() {
        assertThat(RetryAfter.parse(null, NOW)).isEmpty();
        assertThat(RetryAfter.parse("", NOW)).isEmpty();
        assertThat(RetryAfter.parse("-5", NOW)).isEmpty();
        assertThat(RetryAfter.parse("1.5", NOW)).isEmpty();
        assertThat(RetryAfter.parse("soon", NOW)).isEmpty();
        assertThat(RetryAfter.parse("99999999999999999999999", NOW)).isEmpty();
    }

    @Test
    void 밀리초로_표현할_수_없는_큰_값은_없는_것으로_취급() {
        assertThat(RetryAfter.parse("99999999999999999", NOW)).isEmpty();
        assertThat(RetryAfter.parse(String.valueOf(RetryAfter.MAX_DELAY_SECONDS + 1), NOW)).isEmpty();
    }

    @Test
    void 상한_이내의_큰_값은_그대로_사용() {
        assertThat(RetryAfter.parse(String.valueOf(RetryAfter.MAX_DELAY_SECONDS), NOW))
            .hasValueSatisfying(delay -> assertThat(delay.toMillis()).isPositive());
    }
}
