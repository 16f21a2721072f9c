package com.ryuqq.conduit.core.exception;

import com.ryuqq.conduit.core.model.ApiError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * envelope의 {@code success:false} 응답을 나타내는 예외.
 *
 * <p>모든 {@link ApiError}를 순서대로 보존합니다.</p>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public class ApiApplicationException extends ConduitException {

    private final List<ApiError> errors;
    private final List<String> messages;

    public ApiApplicationException(List<ApiError> errors, List<String> messages) {
        super(buildMessage(errors));
        this.errors = errors == null ? List.of() : List.copyOf(errors);
        this.messages = messages == null ? List.of() : List.copyOf(messages);
    }

    private static String buildMessage(List<ApiError> errors) {
        if (errors == null || errors.isEmpty()) {
            return "API request failed without error details";
        }
        return "API request failed: " + errors.stream()
            .map(ApiError::format)
            .collect(Collectors.joining("; "));
    }

    public List<ApiError> getErrors() {
        return errors;
    }

    public List<String> getMessages() {
        return messages;
    }
}
