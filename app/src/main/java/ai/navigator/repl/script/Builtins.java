package ai.navigator.repl.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Built-in functions available to every script. */
public final class Builtins {
    static final int MAX_RANGE_LENGTH = Interpreter.MAX_LOOP_ITERATIONS;

    private Builtins() {}

    public static Map<String, ScriptFunction> all() {
        var functions = new LinkedHashMap<String, ScriptFunction>();
        functions.put("print", Builtins::print);
        functions.put("len", Builtins::len);
        functions.put("str", (ctx, args) -> Values.str(args.bind(0, "object").get(0, "object", "")));
        functions.put("int", Builtins::toInt);
        functions.put("float", Builtins::toFloat);
        functions.put("bool", (ctx, args) -> Values.truthy(args.bind(0, "x").get(0, "x", false)));
        functions.put("list", (ctx, args) -> args.bind(0, "iterable").has(0, "iterable")
                ? Interpreter.iterate(args.get(0, "iterable"), args.line())
                : new ArrayList<>());
        functions.put("range", Builtins::range);
        functions.put("sorted", Builtins::sorted);
        functions.put("min", (ctx, args) -> extreme(args, -1));
        functions.put("max", (ctx, args) -> extreme(args, 1));
        functions.put("sum", Builtins::sum);
        functions.put("enumerate", Builtins::enumerate);
        functions.put("keys", Builtins::keys);
        return functions;
    }

    private static @Nullable Object print(CallContext ctx, Arguments args) {
        var sep = args.keywords().containsKey("sep") ? Values.str(args.keywords().get("sep")) : " ";
        var end = args.keywords().containsKey("end") ? Values.str(args.keywords().get("end")) : "\n";
        for (String keyword : args.keywords().keySet()) {
            if (!keyword.equals("sep") && !keyword.equals("end")) {
                throw ScriptException.type("print() got an unexpected keyword argument '%s'".formatted(keyword), args.line());
            }
        }
        var sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(sep);
            }
            sb.append(Values.str(args.positional().get(i)));
        }
        ctx.print(sb.append(end).toString());
        return null;
    }

    private static Object len(CallContext ctx, Arguments args) {
        var value = args.bind(1, "obj").get(0, "obj");
        if (value instanceof String s) return (long) s.length();
        if (value instanceof List<?> l) return (long) l.size();
        if (value instanceof Map<?, ?> m) return (long) m.size();
        throw ScriptException.type("object of type '%s' has no len()".formatted(Values.typeName(value)), args.line());
    }

    private static Object toInt(CallContext ctx, Arguments args) {
        var value = args.bind(0, "x", "base").get(0, "x", 0L);
        if (value instanceof Boolean b) return b ? 1L : 0L;
        if (value instanceof Long l) return l;
        if (value instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw ScriptException.value("cannot convert float %s to integer".formatted(Values.formatFloat(d)), args.line());
            }
            return (long) d.doubleValue();
        }
        if (value instanceof String s) {
            int base = args.intValue(1, "base", 10);
            try {
                return Long.parseLong(s.strip().replace("_", ""), base);
            } catch (NumberFormatException e) {
                throw ScriptException.value(
                        "invalid literal for int() with base %d: %s".formatted(base, Values.repr(s)), args.line());
            }
        }
        throw ScriptException.type(
                "int() argument must be a string or a number, not '%s'".formatted(Values.typeName(value)), args.line());
    }

    private static Object toFloat(CallContext ctx, Arguments args) {
        var value = args.bind(0, "x").get(0, "x", 0.0);
        if (Values.isNumber(value)) return Values.toDouble(value);
        if (value instanceof String s) {
            var text = s.strip().toLowerCase(Locale.ROOT);
            switch (text) {
                case "nan" -> {
                    return Double.NaN;
                }
                case "inf", "infinity" -> {
                    return Double.POSITIVE_INFINITY;
                }
                case "-inf", "-infinity" -> {
                    return Double.NEGATIVE_INFINITY;
                }
                default -> {
                    try {
                        return Double.parseDouble(text);
                    } catch (NumberFormatException e) {
                        throw ScriptException.value("could not convert string to float: " + Values.repr(s), args.line());
                    }
                }
            }
        }
        throw ScriptException.type(
                "float() argument must be a string or a number, not '%s'".formatted(Values.typeName(value)), args.line());
    }

    private static Object range(CallContext ctx, Arguments args) {
        args.bind(1, "start", "stop", "step");
        long start;
        long stop;
        long step = 1;
        if (args.size() == 1) {
            start = 0;
            stop = args.integer(0, "stop", 0);
        } else {
            start = args.integer(0, "start", 0);
            stop = args.integer(1, "stop", 0);
            step = args.integer(2, "step", 1);
        }
        if (step == 0) {
            throw ScriptException.value("range() arg 3 must not be zero", args.line());
        }
        var result = new ArrayList<Object>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            if (result.size() >= MAX_RANGE_LENGTH) {
                throw ScriptException.value("range() larger than %d elements".formatted(MAX_RANGE_LENGTH), args.line());
            }
            result.add(i);
        }
        return result;
    }

    private static Object sorted(CallContext ctx, Arguments args) {
        args.bind(1, "iterable", "reverse");
        var items = Interpreter.iterate(args.get(0, "iterable"), args.line());
        boolean reverse = Values.truthy(args.get(1, "reverse", false));
        int line = args.line();
        items.sort((a, b) -> reverse ? Values.compare(b, a, line) : Values.compare(a, b, line));
        return items;
    }

    private static @Nullable Object extreme(Arguments args, int sign) {
        String name = sign < 0 ? "min" : "max";
        List<Object> items = args.size() == 1 ? Interpreter.iterate(args.get(0, "iterable"), args.line()) : args.positional();
        if (items.isEmpty()) {
            if (args.keywords().containsKey("default")) {
                return args.keywords().get("default");
            }
            throw ScriptException.value(name + "() arg is an empty sequence", args.line());
        }
        Object best = items.get(0);
        for (Object item : items.subList(1, items.size())) {
            if (Values.compare(item, best, args.line()) * sign > 0) {
                best = item;
            }
        }
        return best;
    }

    private static Object sum(CallContext ctx, Arguments args) {
        args.bind(1, "iterable", "start");
        Object total = args.get(1, "start", 0L);
        for (Object item : Interpreter.iterate(args.get(0, "iterable"), args.line())) {
            total = Interpreter.binary("+", total, item, args.line());
        }
        return total;
    }

    private static Object enumerate(CallContext ctx, Arguments args) {
        args.bind(1, "iterable", "start");
        long index = args.integer(1, "start", 0);
        var result = new ArrayList<Object>();
        for (Object item : Interpreter.iterate(args.get(0, "iterable"), args.line())) {
            var pair = new ArrayList<Object>(2);
            pair.add(index++);
            pair.add(item);
            result.add(pair);
        }
        return result;
    }

    private static Object keys(CallContext ctx, Arguments args) {
        var value = args.bind(1, "mapping").get(0, "mapping");
        if (value instanceof Map<?, ?> map) {
            return new ArrayList<Object>(map.keySet());
        }
        throw ScriptException.type("keys() argument must be dict, not %s".formatted(Values.typeName(value)), args.line());
    }
}
