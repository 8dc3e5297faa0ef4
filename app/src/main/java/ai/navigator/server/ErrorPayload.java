package ai.navigator.server;

import ai.navigator.exception.NavigatorException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Structured error response payload, serialized as {@code {"error": ..., "code": ...}}.
 *
 * @param error A human-readable error message.
 * @param code The error code (e.g., "NOT_FOUND", "BAD_REQUEST").
 */
public record ErrorPayload(@JsonProperty("error") String error, @JsonProperty("code") String code) {

    public ErrorPayload {
        if (error.isBlank()) {
            throw new IllegalArgumentException("error must not be blank");
        }
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
    }

    /**
     * Common error codes as constants.
     */
    public static class Code {
        public static final String NOT_FOUND = "NOT_FOUND";
        public static final String BAD_REQUEST = "BAD_REQUEST";
        public static final String ROOT_MISSING = "ROOT_MISSING";
        public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

        private Code() {}
    }

    public static ErrorPayload of(String code, String message) {
        return new ErrorPayload(message, code);
    }

    public static ErrorPayload badRequest(String message) {
        return of(Code.BAD_REQUEST, message);
    }

    public static ErrorPayload from(NavigatorException e) {
        var message = e.getMessage();
        return of(e.code(), message == null || message.isBlank() ? e.getClass().getSimpleName() : message);
    }

    /**
     * Create an internal error.
     * @param throwable The underlying exception, named in the message.
     */
    public static ErrorPayload internalError(Throwable throwable) {
        return of(Code.INTERNAL_ERROR, "Internal error: " + throwable.getClass().getSimpleName()
                + (throwable.getMessage() == null ? "" : ": " + throwable.getMessage()));
    }
}
