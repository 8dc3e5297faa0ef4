package ai.navigator.repl.script;

import ai.navigator.repl.Dependency;
import ai.navigator.repl.ReplState;
import ai.navigator.repl.script.Ast.Expr;
import ai.navigator.repl.script.Ast.Stmt;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Tree-walking evaluator for parsed scripts.
 *
 * <p>Every simple statement collects the dependencies of whatever it reads (variables and helper calls).
 * An assignment stores that set with the value; an in-place mutation of a variable merges it into the
 * variable's set; a loop variable inherits the set of the iterable.
 */
public final class Interpreter {
    public static final int MAX_LOOP_ITERATIONS = 1_000_000;
    static final int MAX_SEQUENCE_LENGTH = 10_000_000;

    private final ReplState state;
    private final Map<String, ScriptFunction> functions;
    private final ScriptOutput output;
    private Set<Dependency> tracked = new HashSet<>();

    public Interpreter(ReplState state, Map<String, ScriptFunction> functions, ScriptOutput output) {
        this.state = state;
        this.functions = functions;
        this.output = output;
    }

    /** Parses and runs {@code source}. Statements before a failing one keep their effects. */
    public void run(String source) {
        execute(Parser.parse(source));
    }

    public void execute(List<Stmt> statements) {
        for (Stmt statement : statements) {
            exec(statement);
        }
    }

    private void exec(Stmt stmt) {
        if (stmt instanceof Ast.ExprStmt s) {
            tracked = new HashSet<>();
            eval(s.expr());
        } else if (stmt instanceof Ast.Assign s) {
            tracked = new HashSet<>();
            var value = eval(s.value());
            assign(s.target(), value, s.line());
        } else if (stmt instanceof Ast.AugAssign s) {
            tracked = new HashSet<>();
            var current = eval(s.target());
            var value = eval(s.value());
            var result = binary(s.op(), current, value, s.line());
            // lists are extended in place like Python's list +=
            if (s.op().equals("+") && current instanceof List<?> list && result instanceof List<?> combined) {
                @SuppressWarnings("unchecked")
                var target = (List<Object>) list;
                target.clear();
                target.addAll(combined);
                result = target;
            }
            assign(s.target(), result, s.line());
        } else if (stmt instanceof Ast.If s) {
            for (int i = 0; i < s.conditions().size(); i++) {
                tracked = new HashSet<>();
                if (Values.truthy(eval(s.conditions().get(i)))) {
                    execute(s.bodies().get(i));
                    return;
                }
            }
            execute(s.orElse());
        } else if (stmt instanceof Ast.For s) {
            tracked = new HashSet<>();
            var items = iterate(eval(s.iterable()), s.line());
            var iterableDeps = Set.copyOf(tracked);
            int iterations = 0;
            for (Object item : items) {
                if (++iterations > MAX_LOOP_ITERATIONS) {
                    throw new ScriptException(
                            "RuntimeError: loop exceeded %d iterations".formatted(MAX_LOOP_ITERATIONS), s.line());
                }
                tracked = new HashSet<>(iterableDeps);
                assign(s.target(), item, s.line());
                execute(s.body());
            }
        } else if (stmt instanceof Ast.Del s) {
            tracked = new HashSet<>();
            for (Expr target : s.targets()) {
                delete(target);
            }
        } else if (!(stmt instanceof Ast.Pass)) {
            throw ScriptException.syntax("unsupported statement", stmt.line());
        }
    }

    private void assign(Expr target, @Nullable Object value, int line) {
        if (target instanceof Ast.Name name) {
            if (value instanceof FunctionRef ref) {
                throw ScriptException.type("cannot store function '%s' in a variable".formatted(ref.name()), line);
            }
            state.setVariable(name.id(), value, tracked);
        } else if (target instanceof Ast.TupleExpr tuple) {
            var items = iterate(value, line);
            if (items.size() != tuple.items().size()) {
                throw ScriptException.value("expected %d values to unpack, got %d"
                        .formatted(tuple.items().size(), items.size()), line);
            }
            for (int i = 0; i < items.size(); i++) {
                assign(tuple.items().get(i), items.get(i), line);
            }
        } else if (target instanceof Ast.Index index) {
            var container = eval(index.object());
            var key = eval(index.index());
            setItem(container, key, value, line);
            mutated(index.object());
        } else {
            throw ScriptException.syntax("cannot assign to expression", line);
        }
    }

    private void delete(Expr target) {
        if (target instanceof Ast.Name name) {
            if (!state.removeVariable(name.id())) {
                throw nameError(name.id(), name.line());
            }
        } else if (target instanceof Ast.Index index) {
            var container = eval(index.object());
            var key = eval(index.index());
            if (container instanceof List<?> list) {
                list.remove(normalizeIndex(requireIndex(key, index.line()), list.size(), "list assignment index", index.line()));
            } else if (container instanceof Map<?, ?> map) {
                var k = Values.key(key, index.line());
                if (!map.containsKey(k)) {
                    throw new ScriptException("KeyError: " + Values.repr(k), index.line());
                }
                map.remove(k);
            } else {
                throw ScriptException.type(
                        "'%s' object does not support item deletion".formatted(Values.typeName(container)), index.line());
            }
            mutated(index.object());
        } else {
            throw ScriptException.syntax("cannot delete expression", target.line());
        }
    }

    /** Merges the current statement's dependencies into the variable at the root of {@code expr}. */
    private void mutated(Expr expr) {
        Expr root = expr;
        while (true) {
            if (root instanceof Ast.Index i) {
                root = i.object();
            } else if (root instanceof Ast.Slice s) {
                root = s.object();
            } else {
                break;
            }
        }
        if (root instanceof Ast.Name name) {
            state.mergeDependencies(name.id(), tracked);
        }
    }

    private @Nullable Object eval(Expr expr) {
        if (expr instanceof Ast.Literal e) {
            return e.value();
        }
        if (expr instanceof Ast.Name e) {
            var variable = state.variable(e.id());
            if (variable != null) {
                tracked.addAll(variable.dependencies());
                return variable.value();
            }
            if (functions.containsKey(e.id())) {
                return new FunctionRef(e.id());
            }
            throw nameError(e.id(), e.line());
        }
        if (expr instanceof Ast.ListExpr e) {
            var list = new ArrayList<Object>(e.items().size());
            for (Expr item : e.items()) {
                list.add(eval(item));
            }
            return list;
        }
        if (expr instanceof Ast.TupleExpr e) {
            var list = new ArrayList<Object>(e.items().size());
            for (Expr item : e.items()) {
                list.add(eval(item));
            }
            return list;
        }
        if (expr instanceof Ast.DictExpr e) {
            var map = new LinkedHashMap<Object, Object>();
            for (int i = 0; i < e.keys().size(); i++) {
                var key = Values.key(eval(e.keys().get(i)), e.line());
                map.put(key, eval(e.values().get(i)));
            }
            return map;
        }
        if (expr instanceof Ast.Unary e) {
            var operand = eval(e.operand());
            return unary(e.op(), operand, e.line());
        }
        if (expr instanceof Ast.Binary e) {
            var left = eval(e.left());
            var right = eval(e.right());
            return binary(e.op(), left, right, e.line());
        }
        if (expr instanceof Ast.BoolOp e) {
            var left = eval(e.left());
            if (e.op().equals("and")) {
                return Values.truthy(left) ? eval(e.right()) : left;
            }
            return Values.truthy(left) ? left : eval(e.right());
        }
        if (expr instanceof Ast.Compare e) {
            var left = eval(e.operands().get(0));
            for (int i = 0; i < e.ops().size(); i++) {
                var right = eval(e.operands().get(i + 1));
                if (!compare(e.ops().get(i), left, right, e.line())) {
                    return false;
                }
                left = right;
            }
            return true;
        }
        if (expr instanceof Ast.Conditional e) {
            return Values.truthy(eval(e.test())) ? eval(e.body()) : eval(e.orElse());
        }
        if (expr instanceof Ast.Call e) {
            return call(e);
        }
        if (expr instanceof Ast.Index e) {
            var container = eval(e.object());
            var key = eval(e.index());
            return getItem(container, key, e.line());
        }
        if (expr instanceof Ast.Slice e) {
            return slice(e);
        }
        if (expr instanceof Ast.Attribute e) {
            throw new ScriptException(
                    "AttributeError: attribute '%s' can only be used as a method call".formatted(e.name()), e.line());
        }
        throw ScriptException.syntax("unsupported expression", expr.line());
    }

    private @Nullable Object call(Ast.Call e) {
        if (e.function() instanceof Ast.Attribute attribute) {
            var receiver = eval(attribute.object());
            var args = arguments(attribute.name(), e);
            var result = Methods.call(receiver, attribute.name(), args);
            if (Methods.MUTATING.contains(attribute.name())) {
                mutated(attribute.object());
            }
            return result;
        }
        var callee = eval(e.function());
        if (!(callee instanceof FunctionRef ref)) {
            throw ScriptException.type("'%s' object is not callable".formatted(Values.typeName(callee)), e.line());
        }
        var args = arguments(ref.name(), e);
        return functions.get(ref.name()).call(new CallContext(e.line(), tracked, output), args);
    }

    private Arguments arguments(String function, Ast.Call e) {
        var positional = new ArrayList<Object>(e.args().size());
        for (Expr arg : e.args()) {
            positional.add(eval(arg));
        }
        var keywords = new LinkedHashMap<String, Object>();
        for (var kw : e.kwargs().entrySet()) {
            keywords.put(kw.getKey(), eval(kw.getValue()));
        }
        return new Arguments(function, positional, keywords, e.line());
    }

    private @Nullable Object slice(Ast.Slice e) {
        var container = eval(e.object());
        var lower = e.lower() == null ? null : eval(e.lower());
        var upper = e.upper() == null ? null : eval(e.upper());
        var stepValue = e.step() == null ? null : eval(e.step());
        int length;
        if (container instanceof String s) {
            length = s.length();
        } else if (container instanceof List<?> l) {
            length = l.size();
        } else {
            throw ScriptException.type("'%s' object is not subscriptable".formatted(Values.typeName(container)), e.line());
        }
        long step = stepValue == null ? 1 : requireIndex(stepValue, e.line());
        if (step == 0) {
            throw ScriptException.value("slice step cannot be zero", e.line());
        }
        long start = sliceBound(lower, length, step, true, e.line());
        long stop = sliceBound(upper, length, step, false, e.line());

        if (container instanceof String s) {
            var sb = new StringBuilder();
            for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
                sb.append(s.charAt((int) i));
            }
            return sb.toString();
        }
        var list = (List<?>) container;
        var result = new ArrayList<Object>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            result.add(list.get((int) i));
        }
        return result;
    }

    private static long sliceBound(@Nullable Object bound, int length, long step, boolean isStart, int line) {
        if (bound == null) {
            if (step > 0) {
                return isStart ? 0 : length;
            }
            return isStart ? length - 1 : -1;
        }
        long value = requireIndex(bound, line);
        if (value < 0) {
            value += length;
            if (value < 0) {
                value = step > 0 ? 0 : -1;
            }
        } else if (value >= length) {
            value = step > 0 ? length : length - 1;
        }
        return value;
    }

    private static boolean compare(String op, @Nullable Object left, @Nullable Object right, int line) {
        return switch (op) {
            case "==" -> Values.equal(left, right);
            case "!=" -> !Values.equal(left, right);
            case "<" -> Values.compare(left, right, line) < 0;
            case ">" -> Values.compare(left, right, line) > 0;
            case "<=" -> Values.compare(left, right, line) <= 0;
            case ">=" -> Values.compare(left, right, line) >= 0;
            case "in" -> contains(right, left, line);
            case "not in" -> !contains(right, left, line);
            default -> throw ScriptException.syntax("unknown comparison " + op, line);
        };
    }

    private static boolean contains(@Nullable Object container, @Nullable Object item, int line) {
        if (container instanceof String s) {
            if (!(item instanceof String sub)) {
                throw ScriptException.type(
                        "'in <string>' requires string as left operand, not " + Values.typeName(item), line);
            }
            return s.contains(sub);
        }
        if (container instanceof List<?> list) {
            return list.stream().anyMatch(v -> Values.equal(v, item));
        }
        if (container instanceof Map<?, ?> map) {
            return map.containsKey(Values.key(item, line));
        }
        throw ScriptException.type(
                "argument of type '%s' is not iterable".formatted(Values.typeName(container)), line);
    }

    private static Object unary(String op, @Nullable Object operand, int line) {
        if (op.equals("not")) {
            return !Values.truthy(operand);
        }
        var l = Values.asLong(operand);
        if (l != null) {
            try {
                return op.equals("-") ? Math.negateExact(l) : l;
            } catch (ArithmeticException e) {
                throw new ScriptException("OverflowError: integer overflow", line);
            }
        }
        if (operand instanceof Double d) {
            return op.equals("-") ? -d : d;
        }
        throw ScriptException.type("bad operand type for unary %s: '%s'".formatted(op, Values.typeName(operand)), line);
    }

    static Object binary(String op, @Nullable Object left, @Nullable Object right, int line) {
        var li = Values.asLong(left);
        var ri = Values.asLong(right);
        try {
            if (li != null && ri != null) {
                return integerOp(op, li, ri, line);
            }
            if (Values.isNumber(left) && Values.isNumber(right)) {
                return floatOp(op, Values.toDouble(left), Values.toDouble(right), line);
            }
        } catch (ArithmeticException e) {
            throw new ScriptException("OverflowError: integer overflow", line);
        }
        if (op.equals("+")) {
            if (left instanceof String a && right instanceof String b) {
                checkLength((long) a.length() + b.length(), line);
                return a + b;
            }
            if (left instanceof List<?> a && right instanceof List<?> b) {
                var result = new ArrayList<Object>(a);
                result.addAll(b);
                return result;
            }
        }
        if (op.equals("*")) {
            if (left instanceof String s && ri != null) return repeat(s, ri, line);
            if (right instanceof String s && li != null) return repeat(s, li, line);
            if (left instanceof List<?> l && ri != null) return repeat(l, ri, line);
            if (right instanceof List<?> l && li != null) return repeat(l, li, line);
        }
        throw ScriptException.type("unsupported operand type(s) for %s: '%s' and '%s'"
                .formatted(op, Values.typeName(left), Values.typeName(right)), line);
    }

    private static Object integerOp(String op, long a, long b, int line) {
        switch (op) {
            case "+" -> {
                return Math.addExact(a, b);
            }
            case "-" -> {
                return Math.subtractExact(a, b);
            }
            case "*" -> {
                return Math.multiplyExact(a, b);
            }
            case "/" -> {
                if (b == 0) throw zeroDivision("division by zero", line);
                return (double) a / b;
            }
            case "//" -> {
                if (b == 0) throw zeroDivision("integer division or modulo by zero", line);
                return Math.floorDiv(a, b);
            }
            case "%" -> {
                if (b == 0) throw zeroDivision("integer division or modulo by zero", line);
                return Math.floorMod(a, b);
            }
            default -> throw ScriptException.syntax("unknown operator " + op, line);
        }
    }

    private static Object floatOp(String op, double a, double b, int line) {
        switch (op) {
            case "+" -> {
                return a + b;
            }
            case "-" -> {
                return a - b;
            }
            case "*" -> {
                return a * b;
            }
            case "/" -> {
                if (b == 0) throw zeroDivision("float division by zero", line);
                return a / b;
            }
            case "//" -> {
                if (b == 0) throw zeroDivision("float floor division by zero", line);
                return Math.floor(a / b);
            }
            case "%" -> {
                if (b == 0) throw zeroDivision("float modulo", line);
                return a - b * Math.floor(a / b);
            }
            default -> throw ScriptException.syntax("unknown operator " + op, line);
        }
    }

    private static ScriptException zeroDivision(String message, int line) {
        return new ScriptException("ZeroDivisionError: " + message, line);
    }

    private static String repeat(String s, long times, int line) {
        if (times <= 0) return "";
        checkLength(s.length() * times, line);
        return s.repeat((int) times);
    }

    private static List<Object> repeat(List<?> list, long times, int line) {
        var result = new ArrayList<Object>();
        if (times <= 0) return result;
        checkLength(list.size() * times, line);
        for (long i = 0; i < times; i++) {
            result.addAll(list);
        }
        return result;
    }

    private static void checkLength(long length, int line) {
        if (length > MAX_SEQUENCE_LENGTH) {
            throw new ScriptException("MemoryError: result longer than %d elements".formatted(MAX_SEQUENCE_LENGTH), line);
        }
    }

    private static @Nullable Object getItem(@Nullable Object container, @Nullable Object key, int line) {
        if (container instanceof List<?> list) {
            return list.get(normalizeIndex(requireIndex(key, line), list.size(), "list index", line));
        }
        if (container instanceof String s) {
            int i = normalizeIndex(requireIndex(key, line), s.length(), "string index", line);
            return String.valueOf(s.charAt(i));
        }
        if (container instanceof Map<?, ?> map) {
            var k = Values.key(key, line);
            if (!map.containsKey(k)) {
                throw new ScriptException("KeyError: " + Values.repr(k), line);
            }
            return map.get(k);
        }
        throw ScriptException.type("'%s' object is not subscriptable".formatted(Values.typeName(container)), line);
    }

    @SuppressWarnings("unchecked")
    private static void setItem(@Nullable Object container, @Nullable Object key, @Nullable Object value, int line) {
        if (container instanceof List<?> list) {
            ((List<Object>) list).set(normalizeIndex(requireIndex(key, line), list.size(), "list assignment index", line), value);
        } else if (container instanceof Map<?, ?> map) {
            ((Map<Object, Object>) map).put(Values.key(key, line), value);
        } else {
            throw ScriptException.type(
                    "'%s' object does not support item assignment".formatted(Values.typeName(container)), line);
        }
    }

    private static long requireIndex(@Nullable Object key, int line) {
        var l = Values.asLong(key);
        if (l == null) {
            throw ScriptException.type("indices must be integers, not " + Values.typeName(key), line);
        }
        return l;
    }

    static int normalizeIndex(long index, int size, String what, int line) {
        long i = index < 0 ? index + size : index;
        if (i < 0 || i >= size) {
            throw new ScriptException("IndexError: %s out of range".formatted(what), line);
        }
        return (int) i;
    }

    /** Materializes anything a {@code for} loop can walk: list items, string characters or dict keys. */
    static List<Object> iterate(@Nullable Object value, int line) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof String s) {
            var chars = new ArrayList<Object>(s.length());
            for (int i = 0; i < s.length(); i++) {
                chars.add(String.valueOf(s.charAt(i)));
            }
            return chars;
        }
        if (value instanceof Map<?, ?> map) {
            return new ArrayList<>(map.keySet());
        }
        throw ScriptException.type("'%s' object is not iterable".formatted(Values.typeName(value)), line);
    }

    private static ScriptException nameError(String name, int line) {
        return new ScriptException("NameError: name '%s' is not defined".formatted(name), line);
    }

    /** A reference to a named function; only valid in call position. */
    private record FunctionRef(String name) {}
}
