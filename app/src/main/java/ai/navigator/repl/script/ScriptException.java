package ai.navigator.repl.script;

/** Error raised by user code, named after the Python exception it mirrors (NameError, TypeError, ...). */
public class ScriptException extends RuntimeException {
    private final int line;

    public ScriptException(String message, int line) {
        super(message);
        this.line = line;
    }

    public int line() {
        return line;
    }

    public static ScriptException syntax(String message, int line) {
        return new ScriptException("SyntaxError: " + message, line);
    }

    public static ScriptException type(String message, int line) {
        return new ScriptException("TypeError: " + message, line);
    }

    public static ScriptException value(String message, int line) {
        return new ScriptException("ValueError: " + message, line);
    }
}
