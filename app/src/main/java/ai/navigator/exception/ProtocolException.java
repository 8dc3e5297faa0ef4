package ai.navigator.exception;

/** Malformed request: bad JSON, unknown action, wrong field types or a path outside the project root. */
public class ProtocolException extends NavigatorException {
    public static final String CODE = "BAD_REQUEST";

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return CODE;
    }
}
