package ai.navigator.repl.script;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Operations on script values. The value universe is {@code null} (None), {@link Boolean}, {@link Long},
 * {@link Double}, {@link String}, {@link List} and {@link Map}; everything stays JSON-representable so
 * state can be snapshotted.
 */
public final class Values {
    private Values() {}

    public static String typeName(@Nullable Object value) {
        if (value == null) return "NoneType";
        if (value instanceof Boolean) return "bool";
        if (value instanceof Long) return "int";
        if (value instanceof Double) return "float";
        if (value instanceof String) return "str";
        if (value instanceof List) return "list";
        if (value instanceof Map) return "dict";
        return value.getClass().getSimpleName();
    }

    public static boolean truthy(@Nullable Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Long l) return l != 0;
        if (value instanceof Double d) return d != 0.0;
        if (value instanceof String s) return !s.isEmpty();
        if (value instanceof List<?> list) return !list.isEmpty();
        if (value instanceof Map<?, ?> map) return !map.isEmpty();
        return true;
    }

    public static boolean isNumber(@Nullable Object value) {
        return value instanceof Long || value instanceof Double || value instanceof Boolean;
    }

    /** Numeric view of int, float and bool values. */
    public static double toDouble(Object value) {
        if (value instanceof Boolean b) return b ? 1 : 0;
        return ((Number) value).doubleValue();
    }

    /** Integer view of int and bool values; null for anything else. */
    public static @Nullable Long asLong(@Nullable Object value) {
        if (value instanceof Long l) return l;
        if (value instanceof Boolean b) return b ? 1L : 0L;
        return null;
    }

    public static String str(@Nullable Object value) {
        if (value instanceof String s) {
            return s;
        }
        return repr(value);
    }

    public static String repr(@Nullable Object value) {
        if (value == null) return "None";
        if (value instanceof Boolean b) return b ? "True" : "False";
        if (value instanceof Double d) return formatFloat(d);
        if (value instanceof String s) return quote(s);
        if (value instanceof List<?> list) {
            var sb = new StringBuilder("[");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(repr(list.get(i)));
            }
            return sb.append(']').toString();
        }
        if (value instanceof Map<?, ?> map) {
            var sb = new StringBuilder("{");
            boolean first = true;
            for (var e : map.entrySet()) {
                if (!first) sb.append(", ");
                first = false;
                sb.append(repr(e.getKey())).append(": ").append(repr(e.getValue()));
            }
            return sb.append('}').toString();
        }
        return value.toString();
    }

    static String formatFloat(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) < 1e16) {
            return String.valueOf((long) d) + ".0";
        }
        return Double.toString(d);
    }

    private static String quote(String s) {
        char q = s.contains("'") && !s.contains("\"") ? '"' : '\'';
        var sb = new StringBuilder().append(q);
        for (char c : s.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                default -> {
                    if (c == q) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.append(q).toString();
    }

    public static boolean equal(@Nullable Object a, @Nullable Object b) {
        if (isNumber(a) && isNumber(b)) {
            var la = asLong(a);
            var lb = asLong(b);
            if (la != null && lb != null) {
                return la.longValue() == lb.longValue();
            }
            return toDouble(a) == toDouble(b);
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) return false;
            for (int i = 0; i < la.size(); i++) {
                if (!equal(la.get(i), lb.get(i))) return false;
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /** Ordering for {@code < > <= >=}, {@code sorted}, {@code min} and {@code max}. */
    public static int compare(@Nullable Object a, @Nullable Object b, int line) {
        if (isNumber(a) && isNumber(b)) {
            var la = asLong(a);
            var lb = asLong(b);
            if (la != null && lb != null) {
                return Long.compare(la, lb);
            }
            return Double.compare(toDouble(a), toDouble(b));
        }
        if (a instanceof String sa && b instanceof String sb) {
            return sa.compareTo(sb);
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            for (int i = 0; i < Math.min(la.size(), lb.size()); i++) {
                int c = compare(la.get(i), lb.get(i), line);
                if (c != 0) return c;
            }
            return Integer.compare(la.size(), lb.size());
        }
        throw ScriptException.type(
                "'<' not supported between instances of '%s' and '%s'".formatted(typeName(a), typeName(b)), line);
    }

    /** Dict keys: integral floats and bools collapse onto int keys the way Python hashes them. */
    public static @Nullable Object key(@Nullable Object value, int line) {
        if (value instanceof List || value instanceof Map) {
            throw ScriptException.type("unhashable type: '%s'".formatted(typeName(value)), line);
        }
        if (value instanceof Boolean b) return b ? 1L : 0L;
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) return (long) d.doubleValue();
        return value;
    }
}
