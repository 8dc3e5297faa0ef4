package ai.navigator.exception;

/**
 * Source could not be turned into a skeleton. The extractor catches this and stores a raw-snippet
 * record instead, so it only escapes to callers that invoke a strategy directly.
 */
public class ParseException extends NavigatorException {
    public static final String CODE = "PARSE_ERROR";

    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return CODE;
    }
}
