package ai.navigator.repl;

import ai.navigator.util.FileUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Durable copy of the REPL state as versioned JSON. A snapshot written by another format version, or one
 * that cannot be parsed, is discarded on load.
 *
 * <p>Dict keys are written as JSON object keys, so non-string keys come back as strings after a restore.
 */
public final class ReplSnapshotStore {
    private static final Logger logger = LogManager.getLogger(ReplSnapshotStore.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final int FORMAT_VERSION = 1;

    private final Path snapshotFile;

    public ReplSnapshotStore(Path snapshotFile) {
        this.snapshotFile = snapshotFile;
    }

    public Path file() {
        return snapshotFile;
    }

    public void save(ReplState state) throws IOException {
        var variables = new LinkedHashMap<String, VariableEntry>();
        state.variables().forEach((name, v) -> variables.put(name, new VariableEntry(v.value(), sorted(v.dependencies()))));
        var buffers = new LinkedHashMap<String, BufferEntry>();
        state.buffers().forEach((key, b) -> buffers.put(key, new BufferEntry(b.entries(), sorted(b.dependencies()))));
        var snapshot = new Snapshot(FORMAT_VERSION, state.execCount(), state.lastExec(), variables, buffers);
        FileUtil.writeAtomically(snapshotFile, objectMapper.writeValueAsBytes(snapshot));
        logger.debug("Saved REPL snapshot with {} variables to {}", variables.size(), snapshotFile);
    }

    /** @return the restored state, or empty when there is no usable snapshot */
    public Optional<ReplState> load() {
        if (!Files.isRegularFile(snapshotFile)) {
            return Optional.empty();
        }
        try {
            var tree = objectMapper.readTree(snapshotFile.toFile());
            int version = tree.path("format_version").asInt(-1);
            if (version != FORMAT_VERSION) {
                logger.info("Discarding REPL snapshot {} with format version {} (expected {})",
                        snapshotFile, version, FORMAT_VERSION);
                return Optional.empty();
            }
            var snapshot = objectMapper.treeToValue(tree, Snapshot.class);
            var state = new ReplState();
            if (snapshot.variables() != null) {
                snapshot.variables().forEach((name, v) ->
                        state.setVariable(name, normalize(v.value()), dependencies(v.dependencies())));
            }
            if (snapshot.buffers() != null) {
                snapshot.buffers().forEach((key, b) -> state.putBuffer(key, new ReplState.Buffer(
                        b.entries() == null ? List.of() : b.entries(), dependencies(b.dependencies()))));
            }
            state.restoreCounters(snapshot.execCount(), snapshot.lastExec());
            logger.info("Restored REPL snapshot from {} ({} variables)", snapshotFile, state.variables().size());
            return Optional.of(state);
        } catch (JsonProcessingException e) {
            logger.warn("Discarding unreadable REPL snapshot {}: {}", snapshotFile, e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Could not read REPL snapshot {}", snapshotFile, e);
            return Optional.empty();
        }
    }

    public void delete() throws IOException {
        Files.deleteIfExists(snapshotFile);
    }

    private static List<Dependency> sorted(Set<Dependency> dependencies) {
        var list = new ArrayList<>(dependencies);
        list.sort((a, b) -> a.path().equals(b.path())
                ? Long.compare(a.mtime(), b.mtime())
                : a.path().compareTo(b.path()));
        return list;
    }

    private static HashSet<Dependency> dependencies(@Nullable List<Dependency> deps) {
        return deps == null ? new HashSet<>() : new HashSet<>(deps);
    }

    /** Maps Jackson's number and container types back onto the script value universe. */
    private static @Nullable Object normalize(@Nullable Object value) {
        if (value instanceof Integer || value instanceof BigInteger) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigDecimal || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof List<?> list) {
            var result = new ArrayList<Object>(list.size());
            for (Object item : list) {
                result.add(normalize(item));
            }
            return result;
        }
        if (value instanceof Map<?, ?> map) {
            var result = new LinkedHashMap<Object, Object>();
            map.forEach((k, v) -> result.put(k, normalize(v)));
            return result;
        }
        return value;
    }

    record Snapshot(
            @JsonProperty("format_version") int formatVersion,
            @JsonProperty("exec_count") long execCount,
            @JsonProperty("last_exec") @Nullable Long lastExec,
            @JsonProperty("variables") @Nullable Map<String, VariableEntry> variables,
            @JsonProperty("buffers") @Nullable Map<String, BufferEntry> buffers) {}

    record VariableEntry(
            @JsonProperty("value") @Nullable Object value,
            @JsonProperty("dependencies") @Nullable List<Dependency> dependencies) {}

    record BufferEntry(
            @JsonProperty("entries") @Nullable List<String> entries,
            @JsonProperty("dependencies") @Nullable List<Dependency> dependencies) {}
}
