package ai.navigator.repl;

import ai.navigator.util.FileUtil;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares the mtimes captured with REPL variables and buffers against the files on disk. The result is
 * advisory: nothing in the state is refreshed or dropped.
 */
public final class StalenessChecker {
    private final Path root;

    public StalenessChecker(Path root) {
        this.root = root;
    }

    /**
     * @return {@code {variables: {name: [{path, reason}]}, buffers: {...}}} restricted to stale entries,
     *     or an empty map when everything is current
     */
    public Map<String, Object> check(ReplState state) {
        var variables = new LinkedHashMap<String, Object>();
        for (var entry : state.variables().entrySet()) {
            var stale = staleDependencies(entry.getValue().dependencies());
            if (!stale.isEmpty()) {
                variables.put(entry.getKey(), stale);
            }
        }
        var buffers = new LinkedHashMap<String, Object>();
        for (var entry : state.buffers().entrySet()) {
            var stale = staleDependencies(entry.getValue().dependencies());
            if (!stale.isEmpty()) {
                buffers.put(entry.getKey(), stale);
            }
        }
        if (variables.isEmpty() && buffers.isEmpty()) {
            return Map.of();
        }
        var result = new LinkedHashMap<String, Object>();
        result.put("variables", variables);
        result.put("buffers", buffers);
        return result;
    }

    private List<Map<String, String>> staleDependencies(Set<Dependency> dependencies) {
        var sorted = new ArrayList<>(dependencies);
        sorted.sort(Comparator.comparing(Dependency::path).thenComparingLong(Dependency::mtime));
        var stale = new ArrayList<Map<String, String>>();
        for (Dependency dep : sorted) {
            var current = FileUtil.mtimeMillis(root.resolve(dep.path()));
            if (current.isEmpty()) {
                stale.add(Map.of("path", dep.path(), "reason", "deleted"));
            } else if (current.getAsLong() != dep.mtime()) {
                stale.add(Map.of("path", dep.path(), "reason", "modified"));
            }
        }
        return stale;
    }
}
