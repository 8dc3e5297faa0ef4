package ai.navigator.repl.script;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Positional and keyword arguments of one call, bound against a parameter list. */
public final class Arguments {
    private final String function;
    private final List<Object> positional;
    private final Map<String, Object> keywords;
    private final int line;

    public Arguments(String function, List<Object> positional, Map<String, Object> keywords, int line) {
        this.function = function;
        this.positional = positional;
        this.keywords = keywords;
        this.line = line;
    }

    /**
     * Checks the call against a parameter list.
     *
     * @param required number of leading parameters without default
     * @param params parameter names in positional order
     */
    public Arguments bind(int required, String... params) {
        if (positional.size() > params.length) {
            throw ScriptException.type("%s() takes at most %d arguments (%d given)"
                    .formatted(function, params.length, positional.size()), line);
        }
        var names = Arrays.asList(params);
        for (String keyword : keywords.keySet()) {
            int index = names.indexOf(keyword);
            if (index < 0) {
                throw ScriptException.type(
                        "%s() got an unexpected keyword argument '%s'".formatted(function, keyword), line);
            }
            if (index < positional.size()) {
                throw ScriptException.type(
                        "%s() got multiple values for argument '%s'".formatted(function, keyword), line);
            }
        }
        for (int i = 0; i < required; i++) {
            if (i >= positional.size() && !keywords.containsKey(params[i])) {
                throw ScriptException.type(
                        "%s() missing required argument '%s'".formatted(function, params[i]), line);
            }
        }
        return this;
    }

    public boolean has(int index, String name) {
        return index < positional.size() || keywords.containsKey(name);
    }

    public @Nullable Object get(int index, String name, @Nullable Object defaultValue) {
        if (index < positional.size()) {
            return positional.get(index);
        }
        return keywords.containsKey(name) ? keywords.get(name) : defaultValue;
    }

    public @Nullable Object get(int index, String name) {
        return get(index, name, null);
    }

    public String string(int index, String name, @Nullable String defaultValue) {
        var value = get(index, name, defaultValue);
        if (value instanceof String s) {
            return s;
        }
        throw ScriptException.type(
                "%s() argument '%s' must be str, not %s".formatted(function, name, Values.typeName(value)), line);
    }

    public long integer(int index, String name, long defaultValue) {
        var value = get(index, name, defaultValue);
        var l = Values.asLong(value);
        if (l == null) {
            throw ScriptException.type(
                    "%s() argument '%s' must be int, not %s".formatted(function, name, Values.typeName(value)), line);
        }
        return l;
    }

    /** Like {@link #integer} but for parameters held as {@code int}; out-of-range values are a ValueError. */
    public int intValue(int index, String name, int defaultValue) {
        long l = integer(index, name, defaultValue);
        try {
            return Math.toIntExact(l);
        } catch (ArithmeticException e) {
            throw ScriptException.value(
                    "%s() argument '%s' out of range: %d".formatted(function, name, l), line);
        }
    }

    public @Nullable Long optionalInteger(int index, String name) {
        var value = get(index, name, null);
        if (value == null) {
            return null;
        }
        return integer(index, name, 0);
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> keywords() {
        return keywords;
    }

    public int size() {
        return positional.size();
    }

    public String function() {
        return function;
    }

    public int line() {
        return line;
    }
}
