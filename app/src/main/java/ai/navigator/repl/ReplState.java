package ai.navigator.repl;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Variables, buffers and counters of the REPL environment. Only ever touched from the REPL worker
 * thread, so it is not synchronized.
 */
public final class ReplState {

    /** A variable's value together with every file it was derived from. */
    public record Variable(@Nullable Object value, Set<Dependency> dependencies) {
        public Variable {
            dependencies = Set.copyOf(dependencies);
        }
    }

    /** Accumulated text entries of one buffer. */
    public record Buffer(List<String> entries, Set<Dependency> dependencies) {
        public Buffer {
            entries = List.copyOf(entries);
            dependencies = Set.copyOf(dependencies);
        }
    }

    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final Map<String, Buffer> buffers = new LinkedHashMap<>();
    private long execCount;
    private @Nullable Long lastExec;

    public boolean hasVariable(String name) {
        return variables.containsKey(name);
    }

    public @Nullable Variable variable(String name) {
        return variables.get(name);
    }

    public void setVariable(String name, @Nullable Object value, Collection<Dependency> dependencies) {
        // rebinding replaces the dependency set; it does not accumulate
        variables.put(name, new Variable(value, new HashSet<>(dependencies)));
    }

    /** Adds dependencies to an existing variable after an in-place mutation. */
    public void mergeDependencies(String name, Collection<Dependency> dependencies) {
        var existing = variables.get(name);
        if (existing == null || dependencies.isEmpty()) {
            return;
        }
        var merged = new HashSet<>(existing.dependencies());
        merged.addAll(dependencies);
        variables.put(name, new Variable(existing.value(), merged));
    }

    public boolean removeVariable(String name) {
        return variables.remove(name) != null;
    }

    public Map<String, Variable> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public List<String> variableNames() {
        return List.copyOf(variables.keySet());
    }

    public void appendToBuffer(String key, String text, Collection<Dependency> dependencies) {
        var existing = buffers.get(key);
        var entries = new ArrayList<String>();
        var deps = new HashSet<Dependency>(dependencies);
        if (existing != null) {
            entries.addAll(existing.entries());
            deps.addAll(existing.dependencies());
        }
        entries.add(text);
        buffers.put(key, new Buffer(entries, deps));
    }

    public void putBuffer(String key, Buffer buffer) {
        buffers.put(key, buffer);
    }

    public Map<String, Buffer> buffers() {
        return Collections.unmodifiableMap(buffers);
    }

    public long execCount() {
        return execCount;
    }

    public @Nullable Long lastExec() {
        return lastExec;
    }

    public void recordExec(long when) {
        execCount++;
        lastExec = when;
    }

    void restoreCounters(long execCount, @Nullable Long lastExec) {
        this.execCount = execCount;
        this.lastExec = lastExec;
    }
}
