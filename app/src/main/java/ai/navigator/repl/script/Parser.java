package ai.navigator.repl.script;

import ai.navigator.repl.script.Ast.Expr;
import ai.navigator.repl.script.Ast.Stmt;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Recursive-descent parser from tokens to {@link Ast} statements. */
public final class Parser {
    private static final Set<String> KEYWORDS = Set.of(
            "if", "elif", "else", "for", "in", "not", "and", "or", "pass", "del", "True", "False", "None",
            "while", "def", "class", "import", "from", "return", "lambda", "with", "try", "except", "raise");
    private static final Set<String> UNSUPPORTED = Set.of(
            "while", "def", "class", "import", "from", "return", "lambda", "with", "try", "except", "raise");
    private static final Set<String> COMPARISONS = Set.of("==", "!=", "<", ">", "<=", ">=");
    private static final Set<String> AUGMENTED = Set.of("+=", "-=", "*=", "/=", "//=", "%=");

    private final List<Token> tokens;
    private int pos;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static List<Stmt> parse(String source) {
        var parser = new Parser(Lexer.tokenize(source));
        return parser.module();
    }

    private List<Stmt> module() {
        var statements = new ArrayList<Stmt>();
        while (peek().type() != TokenType.EOF) {
            if (peek().type() == TokenType.NEWLINE) {
                advance();
                continue;
            }
            if (peek().type() == TokenType.INDENT) {
                throw new ScriptException("IndentationError: unexpected indent", peek().line());
            }
            statements.addAll(statement());
        }
        return statements;
    }

    private List<Stmt> statement() {
        var t = peek();
        if (t.isKeyword("if")) {
            return List.of(ifStatement());
        }
        if (t.isKeyword("for")) {
            return List.of(forStatement());
        }
        if (t.type() == TokenType.NAME && UNSUPPORTED.contains(t.text())) {
            throw ScriptException.syntax("'" + t.text() + "' is not supported in the REPL", t.line());
        }
        return simpleStatements();
    }

    private List<Stmt> simpleStatements() {
        var result = new ArrayList<Stmt>();
        result.add(simpleStatement());
        while (peek().isOp(";")) {
            advance();
            if (peek().type() == TokenType.NEWLINE || peek().type() == TokenType.EOF) {
                break;
            }
            result.add(simpleStatement());
        }
        expectLineEnd();
        return result;
    }

    private Stmt simpleStatement() {
        var t = peek();
        if (t.isKeyword("pass")) {
            advance();
            return new Ast.Pass(t.line());
        }
        if (t.isKeyword("del")) {
            advance();
            var targets = new ArrayList<Expr>();
            targets.add(checkTarget(postfix(), false));
            while (peek().isOp(",")) {
                advance();
                targets.add(checkTarget(postfix(), false));
            }
            return new Ast.Del(targets, t.line());
        }

        var expr = expressionList();
        var next = peek();
        if (next.isOp("=")) {
            advance();
            var value = expressionList();
            if (peek().isOp("=")) {
                throw ScriptException.syntax("chained assignment is not supported", peek().line());
            }
            return new Ast.Assign(checkTarget(expr, true), value, t.line());
        }
        if (next.type() == TokenType.OP && AUGMENTED.contains(next.text())) {
            advance();
            var value = expressionList();
            var op = next.text().substring(0, next.text().length() - 1);
            return new Ast.AugAssign(checkTarget(expr, false), op, value, t.line());
        }
        return new Ast.ExprStmt(expr, t.line());
    }

    private Expr checkTarget(Expr target, boolean allowTuple) {
        if (target instanceof Ast.Name name) {
            if (KEYWORDS.contains(name.id())) {
                throw ScriptException.syntax("cannot assign to " + name.id(), name.line());
            }
            return target;
        }
        if (target instanceof Ast.Index) {
            return target;
        }
        if (allowTuple && target instanceof Ast.TupleExpr tuple) {
            for (Expr item : tuple.items()) {
                checkTarget(item, false);
            }
            return target;
        }
        throw ScriptException.syntax("cannot assign to expression", target.line());
    }

    private Stmt ifStatement() {
        int line = advance().line();
        var conditions = new ArrayList<Expr>();
        var bodies = new ArrayList<List<Stmt>>();
        conditions.add(expression());
        bodies.add(block());
        List<Stmt> orElse = List.of();
        while (true) {
            if (peek().isKeyword("elif")) {
                advance();
                conditions.add(expression());
                bodies.add(block());
            } else if (peek().isKeyword("else")) {
                advance();
                orElse = block();
                break;
            } else {
                break;
            }
        }
        return new Ast.If(conditions, bodies, orElse, line);
    }

    private Stmt forStatement() {
        int line = advance().line();
        var first = postfix();
        Expr target = first;
        if (peek().isOp(",")) {
            var names = new ArrayList<Expr>();
            names.add(first);
            while (peek().isOp(",")) {
                advance();
                names.add(postfix());
            }
            target = new Ast.TupleExpr(names, line);
        }
        checkTarget(target, true);
        expectKeyword("in");
        var iterable = expressionList();
        return new Ast.For(target, iterable, block(), line);
    }

    private List<Stmt> block() {
        expectOp(":");
        if (peek().type() != TokenType.NEWLINE) {
            return simpleStatements();
        }
        advance();
        if (peek().type() != TokenType.INDENT) {
            throw new ScriptException("IndentationError: expected an indented block", peek().line());
        }
        advance();
        var body = new ArrayList<Stmt>();
        while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.EOF) {
            if (peek().type() == TokenType.NEWLINE) {
                advance();
                continue;
            }
            body.addAll(statement());
        }
        if (peek().type() == TokenType.DEDENT) {
            advance();
        }
        return body;
    }

    // Expressions, lowest precedence first

    private Expr expressionList() {
        var first = expression();
        if (!peek().isOp(",")) {
            return first;
        }
        var items = new ArrayList<Expr>();
        items.add(first);
        while (peek().isOp(",")) {
            advance();
            if (startsExpression()) {
                items.add(expression());
            } else {
                break;
            }
        }
        return new Ast.TupleExpr(items, first.line());
    }

    private Expr expression() {
        var body = or();
        if (peek().isKeyword("if")) {
            advance();
            var test = or();
            expectKeyword("else");
            var orElse = expression();
            return new Ast.Conditional(test, body, orElse, body.line());
        }
        return body;
    }

    private Expr or() {
        var left = and();
        while (peek().isKeyword("or")) {
            int line = advance().line();
            left = new Ast.BoolOp("or", left, and(), line);
        }
        return left;
    }

    private Expr and() {
        var left = not();
        while (peek().isKeyword("and")) {
            int line = advance().line();
            left = new Ast.BoolOp("and", left, not(), line);
        }
        return left;
    }

    private Expr not() {
        if (peek().isKeyword("not")) {
            int line = advance().line();
            return new Ast.Unary("not", not(), line);
        }
        return comparison();
    }

    private Expr comparison() {
        var first = arithmetic();
        var ops = new ArrayList<String>();
        var operands = new ArrayList<Expr>();
        operands.add(first);
        while (true) {
            var t = peek();
            if (t.type() == TokenType.OP && COMPARISONS.contains(t.text())) {
                advance();
                ops.add(t.text());
            } else if (t.isKeyword("in")) {
                advance();
                ops.add("in");
            } else if (t.isKeyword("not") && peekAt(1).isKeyword("in")) {
                advance();
                advance();
                ops.add("not in");
            } else {
                break;
            }
            operands.add(arithmetic());
        }
        return ops.isEmpty() ? first : new Ast.Compare(ops, operands, first.line());
    }

    private Expr arithmetic() {
        var left = term();
        while (peek().isOp("+") || peek().isOp("-")) {
            var op = advance();
            left = new Ast.Binary(op.text(), left, term(), op.line());
        }
        return left;
    }

    private Expr term() {
        var left = unary();
        while (peek().isOp("*") || peek().isOp("/") || peek().isOp("//") || peek().isOp("%")) {
            var op = advance();
            left = new Ast.Binary(op.text(), left, unary(), op.line());
        }
        return left;
    }

    private Expr unary() {
        if (peek().isOp("-") || peek().isOp("+")) {
            var op = advance();
            return new Ast.Unary(op.text(), unary(), op.line());
        }
        return postfix();
    }

    private Expr postfix() {
        var expr = atom();
        while (true) {
            var t = peek();
            if (t.isOp("(")) {
                advance();
                expr = call(expr, t.line());
            } else if (t.isOp("[")) {
                advance();
                expr = subscript(expr, t.line());
            } else if (t.isOp(".")) {
                advance();
                var name = advance();
                if (name.type() != TokenType.NAME) {
                    throw ScriptException.syntax("expected attribute name after '.'", name.line());
                }
                expr = new Ast.Attribute(expr, name.text(), name.line());
            } else {
                return expr;
            }
        }
    }

    private Expr call(Expr function, int line) {
        var args = new ArrayList<Expr>();
        var kwargs = new LinkedHashMap<String, Expr>();
        while (!peek().isOp(")")) {
            if (peek().type() == TokenType.NAME && peekAt(1).isOp("=")) {
                var name = advance().text();
                advance();
                if (kwargs.put(name, expression()) != null) {
                    throw ScriptException.syntax("keyword argument repeated: " + name, line);
                }
            } else {
                if (!kwargs.isEmpty()) {
                    throw ScriptException.syntax("positional argument follows keyword argument", line);
                }
                args.add(expression());
            }
            if (!peek().isOp(",")) {
                break;
            }
            advance();
        }
        expectOp(")");
        return new Ast.Call(function, args, kwargs, line);
    }

    private Expr subscript(Expr object, int line) {
        @Nullable Expr lower = null;
        if (!peek().isOp(":")) {
            lower = expression();
            if (peek().isOp("]")) {
                advance();
                return new Ast.Index(object, lower, line);
            }
        }
        expectOp(":");
        @Nullable Expr upper = peek().isOp("]") || peek().isOp(":") ? null : expression();
        @Nullable Expr step = null;
        if (peek().isOp(":")) {
            advance();
            step = peek().isOp("]") ? null : expression();
        }
        expectOp("]");
        return new Ast.Slice(object, lower, upper, step, line);
    }

    private Expr atom() {
        var t = advance();
        switch (t.type()) {
            case INT, FLOAT -> {
                return new Ast.Literal(t.value(), t.line());
            }
            case STRING -> {
                // adjacent literals concatenate
                var sb = new StringBuilder((String) t.value());
                while (peek().type() == TokenType.STRING) {
                    sb.append((String) advance().value());
                }
                return new Ast.Literal(sb.toString(), t.line());
            }
            case NAME -> {
                switch (t.text()) {
                    case "True" -> {
                        return new Ast.Literal(Boolean.TRUE, t.line());
                    }
                    case "False" -> {
                        return new Ast.Literal(Boolean.FALSE, t.line());
                    }
                    case "None" -> {
                        return new Ast.Literal(null, t.line());
                    }
                    default -> {
                        if (KEYWORDS.contains(t.text())) {
                            throw ScriptException.syntax("unexpected keyword '" + t.text() + "'", t.line());
                        }
                        return new Ast.Name(t.text(), t.line());
                    }
                }
            }
            case OP -> {
                switch (t.text()) {
                    case "(" -> {
                        return parenthesized(t.line());
                    }
                    case "[" -> {
                        var items = new ArrayList<Expr>();
                        while (!peek().isOp("]")) {
                            items.add(expression());
                            if (!peek().isOp(",")) {
                                break;
                            }
                            advance();
                        }
                        expectOp("]");
                        return new Ast.ListExpr(items, t.line());
                    }
                    case "{" -> {
                        var keys = new ArrayList<Expr>();
                        var values = new ArrayList<Expr>();
                        while (!peek().isOp("}")) {
                            keys.add(expression());
                            expectOp(":");
                            values.add(expression());
                            if (!peek().isOp(",")) {
                                break;
                            }
                            advance();
                        }
                        expectOp("}");
                        return new Ast.DictExpr(keys, values, t.line());
                    }
                    default -> throw ScriptException.syntax("unexpected " + t, t.line());
                }
            }
            default -> throw ScriptException.syntax("unexpected " + t, t.line());
        }
    }

    private Expr parenthesized(int line) {
        if (peek().isOp(")")) {
            advance();
            return new Ast.TupleExpr(List.of(), line);
        }
        var first = expression();
        if (peek().isOp(")")) {
            advance();
            return first;
        }
        var items = new ArrayList<Expr>();
        items.add(first);
        while (peek().isOp(",")) {
            advance();
            if (peek().isOp(")")) {
                break;
            }
            items.add(expression());
        }
        expectOp(")");
        return new Ast.TupleExpr(items, line);
    }

    private boolean startsExpression() {
        var t = peek();
        return switch (t.type()) {
            case INT, FLOAT, STRING -> true;
            case NAME -> !KEYWORDS.contains(t.text())
                    || t.text().equals("not")
                    || t.text().equals("True")
                    || t.text().equals("False")
                    || t.text().equals("None");
            case OP -> t.isOp("(") || t.isOp("[") || t.isOp("{") || t.isOp("-") || t.isOp("+");
            default -> false;
        };
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    private Token advance() {
        var t = tokens.get(pos);
        if (t.type() != TokenType.EOF) {
            pos++;
        }
        return t;
    }

    private void expectOp(String op) {
        var t = advance();
        if (!t.isOp(op)) {
            throw ScriptException.syntax("expected '" + op + "' but found " + t, t.line());
        }
    }

    private void expectKeyword(String keyword) {
        var t = advance();
        if (!t.isKeyword(keyword)) {
            throw ScriptException.syntax("expected '" + keyword + "' but found " + t, t.line());
        }
    }

    private void expectLineEnd() {
        var t = peek();
        if (t.type() == TokenType.NEWLINE) {
            advance();
        } else if (t.type() != TokenType.EOF && t.type() != TokenType.DEDENT) {
            throw ScriptException.syntax("unexpected " + t, t.line());
        }
    }
}
