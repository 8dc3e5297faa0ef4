package ai.navigator.repl.script;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/** Methods of the built-in str, list and dict types. */
final class Methods {
    /** Methods that change their receiver in place. */
    static final Set<String> MUTATING = Set.of("append", "extend", "pop", "insert", "remove", "clear", "update");

    private Methods() {}

    static @Nullable Object call(@Nullable Object receiver, String name, Arguments args) {
        if (receiver instanceof String s) {
            return stringMethod(s, name, args);
        }
        if (receiver instanceof List<?> list) {
            @SuppressWarnings("unchecked")
            var mutable = (List<Object>) list;
            return listMethod(mutable, name, args);
        }
        if (receiver instanceof Map<?, ?> map) {
            @SuppressWarnings("unchecked")
            var mutable = (Map<Object, Object>) map;
            return dictMethod(mutable, name, args);
        }
        throw noSuchMethod(receiver, name, args.line());
    }

    private static ScriptException noSuchMethod(@Nullable Object receiver, String name, int line) {
        return new ScriptException(
                "AttributeError: '%s' object has no attribute '%s'".formatted(Values.typeName(receiver), name), line);
    }

    private static Object stringMethod(String s, String name, Arguments args) {
        int line = args.line();
        switch (name) {
            case "split" -> {
                args.bind(0, "sep", "maxsplit");
                var sep = args.get(0, "sep");
                long maxsplit = args.integer(1, "maxsplit", -1);
                return sep == null ? splitWhitespace(s, maxsplit) : split(s, args.string(0, "sep", null), maxsplit, line);
            }
            case "splitlines" -> {
                args.bind(0, "keepends");
                boolean keepEnds = Values.truthy(args.get(0, "keepends", false));
                var result = new ArrayList<Object>();
                int start = 0;
                for (int i = 0; i < s.length(); i++) {
                    char c = s.charAt(i);
                    if (c == '\n' || c == '\r') {
                        int end = i;
                        if (c == '\r' && i + 1 < s.length() && s.charAt(i + 1) == '\n') {
                            i++;
                        }
                        result.add(keepEnds ? s.substring(start, i + 1) : s.substring(start, end));
                        start = i + 1;
                    }
                }
                if (start < s.length()) {
                    result.add(s.substring(start));
                }
                return result;
            }
            case "strip", "lstrip", "rstrip" -> {
                args.bind(0, "chars");
                var chars = args.get(0, "chars");
                String set = chars == null ? null : args.string(0, "chars", null);
                int from = 0;
                int to = s.length();
                if (!name.equals("rstrip")) {
                    while (from < to && stripped(s.charAt(from), set)) from++;
                }
                if (!name.equals("lstrip")) {
                    while (to > from && stripped(s.charAt(to - 1), set)) to--;
                }
                return s.substring(from, to);
            }
            case "lower" -> {
                args.bind(0);
                return s.toLowerCase(Locale.ROOT);
            }
            case "upper" -> {
                args.bind(0);
                return s.toUpperCase(Locale.ROOT);
            }
            case "startswith" -> {
                return s.startsWith(args.bind(1, "prefix").string(0, "prefix", null));
            }
            case "endswith" -> {
                return s.endsWith(args.bind(1, "suffix").string(0, "suffix", null));
            }
            case "replace" -> {
                args.bind(2, "old", "new");
                return s.replace(args.string(0, "old", null), args.string(1, "new", null));
            }
            case "find" -> {
                return (long) s.indexOf(args.bind(1, "sub").string(0, "sub", null));
            }
            case "count" -> {
                var sub = args.bind(1, "sub").string(0, "sub", null);
                if (sub.isEmpty()) {
                    return (long) s.length() + 1;
                }
                long count = 0;
                for (int i = s.indexOf(sub); i >= 0; i = s.indexOf(sub, i + sub.length())) {
                    count++;
                }
                return count;
            }
            case "join" -> {
                var parts = Interpreter.iterate(args.bind(1, "iterable").get(0, "iterable"), line);
                var sb = new StringBuilder();
                for (int i = 0; i < parts.size(); i++) {
                    if (!(parts.get(i) instanceof String part)) {
                        throw ScriptException.type("sequence item %d: expected str instance, %s found"
                                .formatted(i, Values.typeName(parts.get(i))), line);
                    }
                    if (i > 0) sb.append(s);
                    sb.append(part);
                }
                return sb.toString();
            }
            default -> throw noSuchMethod(s, name, line);
        }
    }

    private static boolean stripped(char c, @Nullable String chars) {
        return chars == null ? Character.isWhitespace(c) : chars.indexOf(c) >= 0;
    }

    private static List<Object> splitWhitespace(String s, long maxsplit) {
        var result = new ArrayList<Object>();
        int i = 0;
        int n = s.length();
        while (true) {
            while (i < n && Character.isWhitespace(s.charAt(i))) i++;
            if (i >= n) break;
            if (maxsplit >= 0 && result.size() >= maxsplit) {
                result.add(s.substring(i).stripTrailing());
                break;
            }
            int start = i;
            while (i < n && !Character.isWhitespace(s.charAt(i))) i++;
            result.add(s.substring(start, i));
        }
        return result;
    }

    private static List<Object> split(String s, String sep, long maxsplit, int line) {
        if (sep.isEmpty()) {
            throw ScriptException.value("empty separator", line);
        }
        var result = new ArrayList<Object>();
        int start = 0;
        int idx;
        while ((maxsplit < 0 || result.size() < maxsplit) && (idx = s.indexOf(sep, start)) >= 0) {
            result.add(s.substring(start, idx));
            start = idx + sep.length();
        }
        result.add(s.substring(start));
        return result;
    }

    private static @Nullable Object listMethod(List<Object> list, String name, Arguments args) {
        int line = args.line();
        switch (name) {
            case "append" -> {
                list.add(args.bind(1, "object").get(0, "object"));
                return null;
            }
            case "extend" -> {
                list.addAll(Interpreter.iterate(args.bind(1, "iterable").get(0, "iterable"), line));
                return null;
            }
            case "pop" -> {
                long index = args.bind(0, "index").integer(0, "index", -1);
                if (list.isEmpty()) {
                    throw new ScriptException("IndexError: pop from empty list", line);
                }
                return list.remove(Interpreter.normalizeIndex(index, list.size(), "pop index", line));
            }
            case "insert" -> {
                args.bind(2, "index", "object");
                long index = args.integer(0, "index", 0);
                int size = list.size();
                long clamped = index < 0 ? Math.max(0, size + index) : Math.min(size, index);
                list.add((int) clamped, args.get(1, "object"));
                return null;
            }
            case "remove" -> {
                var target = args.bind(1, "value").get(0, "value");
                for (int i = 0; i < list.size(); i++) {
                    if (Values.equal(list.get(i), target)) {
                        list.remove(i);
                        return null;
                    }
                }
                throw ScriptException.value("list.remove(x): x not in list", line);
            }
            case "index" -> {
                var target = args.bind(1, "value").get(0, "value");
                for (int i = 0; i < list.size(); i++) {
                    if (Values.equal(list.get(i), target)) {
                        return (long) i;
                    }
                }
                throw ScriptException.value(Values.repr(target) + " is not in list", line);
            }
            case "count" -> {
                var target = args.bind(1, "value").get(0, "value");
                return list.stream().filter(v -> Values.equal(v, target)).count();
            }
            case "clear" -> {
                args.bind(0);
                list.clear();
                return null;
            }
            default -> throw noSuchMethod(list, name, line);
        }
    }

    private static @Nullable Object dictMethod(Map<Object, Object> map, String name, Arguments args) {
        int line = args.line();
        switch (name) {
            case "get" -> {
                args.bind(1, "key", "default");
                var key = Values.key(args.get(0, "key"), line);
                return map.containsKey(key) ? map.get(key) : args.get(1, "default");
            }
            case "keys" -> {
                args.bind(0);
                return new ArrayList<Object>(map.keySet());
            }
            case "values" -> {
                args.bind(0);
                return new ArrayList<Object>(map.values());
            }
            case "items" -> {
                args.bind(0);
                var result = new ArrayList<Object>();
                for (var e : map.entrySet()) {
                    var pair = new ArrayList<Object>(2);
                    pair.add(e.getKey());
                    pair.add(e.getValue());
                    result.add(pair);
                }
                return result;
            }
            case "pop" -> {
                args.bind(1, "key", "default");
                var key = Values.key(args.get(0, "key"), line);
                if (map.containsKey(key)) {
                    return map.remove(key);
                }
                if (args.has(1, "default")) {
                    return args.get(1, "default");
                }
                throw new ScriptException("KeyError: " + Values.repr(key), line);
            }
            case "update" -> {
                var other = args.bind(1, "other").get(0, "other");
                if (!(other instanceof Map<?, ?> m)) {
                    throw ScriptException.type("'%s' object is not a mapping".formatted(Values.typeName(other)), line);
                }
                map.putAll(m);
                return null;
            }
            case "clear" -> {
                args.bind(0);
                map.clear();
                return null;
            }
            default -> throw noSuchMethod(map, name, line);
        }
    }
}
