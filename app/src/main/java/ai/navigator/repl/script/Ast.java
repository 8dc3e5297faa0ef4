package ai.navigator.repl.script;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Syntax tree of the REPL script language. Every node remembers its source line for error reporting. */
public final class Ast {
    private Ast() {}

    public sealed interface Stmt {
        int line();
    }

    public record ExprStmt(Expr expr, int line) implements Stmt {}

    /** {@code target} is a {@link Name}, {@link Index} or {@link TupleExpr} of names. */
    public record Assign(Expr target, Expr value, int line) implements Stmt {}

    public record AugAssign(Expr target, String op, Expr value, int line) implements Stmt {}

    /** {@code if}/{@code elif} branches in order, then the optional {@code else} body (empty if absent). */
    public record If(List<Expr> conditions, List<List<Stmt>> bodies, List<Stmt> orElse, int line) implements Stmt {}

    public record For(Expr target, Expr iterable, List<Stmt> body, int line) implements Stmt {}

    public record Pass(int line) implements Stmt {}

    public record Del(List<Expr> targets, int line) implements Stmt {}

    public sealed interface Expr {
        int line();
    }

    public record Literal(@Nullable Object value, int line) implements Expr {}

    public record Name(String id, int line) implements Expr {}

    public record ListExpr(List<Expr> items, int line) implements Expr {}

    public record TupleExpr(List<Expr> items, int line) implements Expr {}

    public record DictExpr(List<Expr> keys, List<Expr> values, int line) implements Expr {}

    public record Unary(String op, Expr operand, int line) implements Expr {}

    public record Binary(String op, Expr left, Expr right, int line) implements Expr {}

    public record BoolOp(String op, Expr left, Expr right, int line) implements Expr {}

    /** Chained comparison {@code a < b <= c}: {@code operands} has one more element than {@code ops}. */
    public record Compare(List<String> ops, List<Expr> operands, int line) implements Expr {}

    public record Conditional(Expr test, Expr body, Expr orElse, int line) implements Expr {}

    public record Call(Expr function, List<Expr> args, Map<String, Expr> kwargs, int line) implements Expr {}

    public record Attribute(Expr object, String name, int line) implements Expr {}

    public record Index(Expr object, Expr index, int line) implements Expr {}

    public record Slice(Expr object, @Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step, int line)
            implements Expr {}
}
