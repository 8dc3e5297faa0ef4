package ai.navigator.repl.script;

import org.jetbrains.annotations.Nullable;

/**
 * @param text source spelling for names and operators
 * @param value decoded literal for numbers and strings
 * @param line 1-based line where the token starts
 */
public record Token(TokenType type, String text, @Nullable Object value, int line) {

    public boolean is(TokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    public boolean isOp(String op) {
        return is(TokenType.OP, op);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenType.NAME, keyword);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE -> "newline";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of input";
            default -> "'" + text + "'";
        };
    }
}
