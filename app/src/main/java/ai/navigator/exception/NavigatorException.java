package ai.navigator.exception;

/**
 * Base class for the daemon's reportable failures. Every subclass maps to a stable error code that is
 * sent back to clients in the {@code code} field of an error response.
 */
public abstract class NavigatorException extends RuntimeException {

    protected NavigatorException(String message) {
        super(message);
    }

    protected NavigatorException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();
}
