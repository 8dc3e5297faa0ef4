package ai.navigator.exception;

/** Unknown path, symbol or chunk. Reported to the client, never fatal. */
public class NotFoundException extends NavigatorException {
    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException file(String path) {
        return new NotFoundException("File not found: " + path);
    }

    public static NotFoundException symbol(String symbol, String path) {
        return new NotFoundException("Symbol '%s' not found in %s".formatted(symbol, path));
    }

    @Override
    public String code() {
        return CODE;
    }
}
