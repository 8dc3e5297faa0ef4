package ai.navigator.repl.script;

public enum TokenType {
    NAME,
    INT,
    FLOAT,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
