package com.ryuqq.conduit.core.exception;

/**
 * Conduit 실패 예외의 공통 상위 타입 (unchecked).
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public abstract class ConduitException extends RuntimeException {

    protected ConduitException(String message) {
        super(message);
    }

    protected ConduitException(String message, Throwable cause) {
        super(message, cause);
    }
}
