package ai.navigator.repl.script;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokenizer for the REPL script language. Indentation is turned into INDENT/DEDENT tokens; line breaks
 * inside brackets and after a backslash are joined.
 */
public final class Lexer {
    private static final List<String> OPERATORS = List.of(
            "//=", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=", "//",
            "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=", "<", ">", "+", "-", "*", "/", "%");

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int depth;

    private Lexer(String src) {
        this.src = src.replace("\r\n", "\n").replace('\r', '\n');
        indents.push(0);
    }

    public static List<Token> tokenize(String src) {
        var lexer = new Lexer(src);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        boolean lineStart = true;
        while (pos < src.length()) {
            if (lineStart && depth == 0) {
                if (handleIndentation()) {
                    // blank or comment-only line, still at the start of a logical line
                    continue;
                }
                lineStart = false;
            }
            char c = src.charAt(pos);
            if (c == '\n') {
                pos++;
                if (depth == 0) {
                    addNewline();
                    lineStart = true;
                }
                line++;
            } else if (c == ' ' || c == '\t') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\' && peek(1) == '\n') {
                pos += 2;
                line++;
            } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                number();
            } else if (isStringStart()) {
                string();
            } else if (Character.isLetter(c) || c == '_') {
                name();
            } else {
                operator();
            }
        }
        if (depth > 0) {
            throw ScriptException.syntax("unexpected end of input inside brackets", line);
        }
        addNewline();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(TokenType.DEDENT, "", null, line));
        }
        tokens.add(new Token(TokenType.EOF, "", null, line));
    }

    /** @return true if the whole line was blank or a comment and has been consumed */
    private boolean handleIndentation() {
        int width = 0;
        int p = pos;
        while (p < src.length() && (src.charAt(p) == ' ' || src.charAt(p) == '\t')) {
            width = src.charAt(p) == '\t' ? (width / 8 + 1) * 8 : width + 1;
            p++;
        }
        if (p >= src.length() || src.charAt(p) == '\n' || src.charAt(p) == '#') {
            pos = p;
            if (pos < src.length() && src.charAt(pos) == '#') {
                skipComment();
            }
            if (pos < src.length()) {
                pos++;
                line++;
            }
            return true;
        }
        pos = p;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            tokens.add(new Token(TokenType.INDENT, "", null, line));
        } else {
            while (width < indents.peek()) {
                indents.pop();
                tokens.add(new Token(TokenType.DEDENT, "", null, line));
            }
            if (width != indents.peek()) {
                throw new ScriptException("IndentationError: unindent does not match any outer indentation level", line);
            }
        }
        return false;
    }

    private void addNewline() {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "", null, line));
        }
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') {
            pos++;
        }
    }

    private char peek(int offset) {
        int p = pos + offset;
        return p < src.length() ? src.charAt(p) : '\0';
    }

    private void number() {
        int start = pos;
        boolean isFloat = false;
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        if (pos < src.length() && src.charAt(pos) == '.' && peek(1) != '.') {
            isFloat = true;
            pos++;
            while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                pos++;
            }
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int save = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                isFloat = true;
                while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = save;
            }
        }
        var text = src.substring(start, pos);
        var digits = text.replace("_", "");
        try {
            if (isFloat) {
                tokens.add(new Token(TokenType.FLOAT, text, Double.parseDouble(digits), line));
            } else {
                tokens.add(new Token(TokenType.INT, text, Long.parseLong(digits), line));
            }
        } catch (NumberFormatException e) {
            throw ScriptException.syntax("invalid number literal " + text, line);
        }
    }

    private boolean isStringStart() {
        char c = src.charAt(pos);
        if (c == '"' || c == '\'') {
            return true;
        }
        return (c == 'r' || c == 'R') && (peek(1) == '"' || peek(1) == '\'');
    }

    private void string() {
        int startLine = line;
        boolean raw = false;
        if (src.charAt(pos) == 'r' || src.charAt(pos) == 'R') {
            raw = true;
            pos++;
        }
        char quote = src.charAt(pos);
        boolean triple = peek(1) == quote && peek(2) == quote;
        pos += triple ? 3 : 1;

        var sb = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw ScriptException.syntax("unterminated string literal", startLine);
            }
            char c = src.charAt(pos);
            if (triple) {
                if (c == quote && peek(1) == quote && peek(2) == quote) {
                    pos += 3;
                    break;
                }
            } else if (c == quote) {
                pos++;
                break;
            } else if (c == '\n') {
                throw ScriptException.syntax("unterminated string literal", startLine);
            }

            if (c == '\\' && pos + 1 < src.length()) {
                char next = src.charAt(pos + 1);
                pos += 2;
                if (next == '\n') {
                    line++;
                    if (raw) {
                        sb.append('\\').append('\n');
                    }
                    continue;
                }
                if (raw) {
                    sb.append('\\').append(next);
                } else {
                    appendEscape(sb, next);
                }
                continue;
            }
            if (c == '\n') {
                line++;
            }
            sb.append(c);
            pos++;
        }
        tokens.add(new Token(TokenType.STRING, sb.toString(), sb.toString(), startLine));
    }

    private void appendEscape(StringBuilder sb, char next) {
        switch (next) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case '0' -> sb.append('\0');
            case '\\' -> sb.append('\\');
            case '\'' -> sb.append('\'');
            case '"' -> sb.append('"');
            case 'x' -> {
                if (pos + 2 <= src.length()) {
                    try {
                        sb.append((char) Integer.parseInt(src.substring(pos, pos + 2), 16));
                        pos += 2;
                        return;
                    } catch (NumberFormatException e) {
                        throw ScriptException.syntax("invalid \\x escape", line);
                    }
                }
                throw ScriptException.syntax("invalid \\x escape", line);
            }
            default -> sb.append('\\').append(next);
        }
    }

    private void name() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        tokens.add(new Token(TokenType.NAME, src.substring(start, pos), null, line));
    }

    private void operator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                pos += op.length();
                switch (op) {
                    case "(", "[", "{" -> depth++;
                    case ")", "]", "}" -> {
                        if (depth == 0) {
                            throw ScriptException.syntax("unmatched '" + op + "'", line);
                        }
                        depth--;
                    }
                    default -> {}
                }
                tokens.add(new Token(TokenType.OP, op, null, line));
                return;
            }
        }
        throw ScriptException.syntax("invalid character '" + src.charAt(pos) + "'", line);
    }
}
