package com.ryuqq.conduit.core.decode;

import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.PipelineOutcome;
import com.ryuqq.conduit.core.outcome.Success;
import com.ryuqq.conduit.core.outcome.TransportFailure;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * RawDecoders 테스트.
 *
 * @author Conduit Team
 * @since 1.0.0
 */
class RawDecodersTest {

    @Test
    void 성공_응답은_본문을_그대로_반환() {
        PipelineOutcome<Optional<String>> outcome = RawDecoders.string()
            .decode("{\"not\":\"an envelope\"}".getBytes(StandardCharsets.UTF_8), 200);

        assertThat(outcome).isEqualTo(new Success<>(Optional.of("{\"not\":\"an envelope\"}")));
    }

    @Test
    void 상태_404는_없는_값() {
        assertThat(RawDecoders.string().decode(new byte[0], 404)).isEqualTo(new Success<>(Optional.empty()));
        assertThat(RawDecoders.bytes().decode("missing".getBytes(StandardCharsets.UTF_8), 404))
            .isEqualTo(new Success<>(Optional.empty()));
    }

    @Test
    void 그_외_상태는_HTTP_STATUS_실패() {
        PipelineOutcome<Optional<byte[]>> outcome = RawDecoders.bytes()
            .decode("oops".getBytes(StandardCharsets.UTF_8), 500);

        assertThat(outcome).isInstanceOf(TransportFailure.class);
        TransportFailure<Optional<byte[]>> failure = (TransportFailure<Optional<byte[]>>) outcome;
        assertThat(failure.kind()).isEqualTo(FailureKind.HTTP_STATUS);
        assertThat(failure.statusCode()).isEqualTo(500);
        assertThat(failure.detail()).isEqualTo("HTTP 500: oops");
    }

    @Test
    void 긴_본문은_설명에서_잘림() {
        String detail = RawDecoders.describeStatus(502, "x".repeat(2000).getBytes(StandardCharsets.UTF_8));

        assertThat(detail).startsWith("HTTP 502: xxx").endsWith("...").hasSizeLessThan(600);
    }
}
