package ai.navigator.exception;

/** User code in the REPL failed, either at parse time or while running. Carries the 1-based source line. */
public class ReplExecException extends NavigatorException {
    public static final String CODE = "REPL_ERROR";

    private final int line;

    public ReplExecException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int line() {
        return line;
    }

    /** Traceback-style text returned to the client in place of a stack trace. */
    public String describe() {
        return line > 0 ? "Error on line %d: %s".formatted(line, getMessage()) : "Error: " + getMessage();
    }

    @Override
    public String code() {
        return CODE;
    }
}
