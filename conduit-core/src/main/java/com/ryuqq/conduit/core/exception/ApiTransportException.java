package com.ryuqq.conduit.core.exception;

import com.ryuqq.conduit.core.outcome.FailureKind;
import com.ryuqq.conduit.core.outcome.TransportFailure;

import java.util.Optional;

/**
 * {@link TransportFailure}를 나타내는 예외.
 *
 * <p>실패 분류, 상태 코드, 원인 예외를 그대로 보존합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class ApiTransportException extends ConduitException {

    private final TransportFailure<?> failure;

    public ApiTransportException(TransportFailure<?> failure) {
        super(buildMessage(failure), failure.cause());
        this.failure = failure;
    }

    private static String buildMessage(TransportFailure<?> failure) {
        if (failure.statusCode() != null) {
            return failure.kind() + " (HTTP " + failure.statusCode() + "): " + failure.detail();
        }
        return failure.kind() + ": " + failure.detail();
    }

    public TransportFailure<?> getFailure() {
        return failure;
    }

    public FailureKind getKind() {
        return failure.kind();
    }

    public Optional<Integer> getStatusCode() {
        return failure.status();
    }
}
