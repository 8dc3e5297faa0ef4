package ai.navigator.repl;

import ai.navigator.exception.ReplExecException;
import ai.navigator.index.IgnoreRules;
import ai.navigator.repl.script.Builtins;
import ai.navigator.repl.script.Interpreter;
import ai.navigator.repl.script.ScriptException;
import ai.navigator.repl.script.ScriptFunction;
import ai.navigator.repl.script.ScriptOutput;
import ai.navigator.util.ExecutorServiceUtil;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The daemon's single persistent REPL environment.
 *
 * <p>Every operation runs on one dedicated worker thread, so REPL requests are serialized with each other
 * while the rest of the query server keeps serving. State is snapshotted after every exec and restored
 * from the snapshot on construction.
 */
public final class ReplEngine implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ReplEngine.class);

    public static final int MAX_OUTPUT_CHARS = 8000;

    private final Path root;
    private final Path chunksDir;
    private final IgnoreRules ignoreRules;
    private final ReplSnapshotStore snapshots;
    private final StalenessChecker staleness;
    private final ExecutorService worker;
    private final LongSupplier clock;

    private ReplState state;

    public ReplEngine(Path root, IgnoreRules ignoreRules) {
        this(root, ignoreRules, System::currentTimeMillis);
    }

    @VisibleForTesting
    ReplEngine(Path root, IgnoreRules ignoreRules, LongSupplier clock) {
        this.root = root;
        this.ignoreRules = ignoreRules;
        this.clock = clock;
        var replDir = root.resolve(".rlm").resolve("repl");
        this.chunksDir = replDir.resolve("chunks");
        this.snapshots = new ReplSnapshotStore(replDir.resolve("state.json"));
        this.staleness = new StalenessChecker(root);
        this.worker = ExecutorServiceUtil.newSerialExecutor("repl");
        this.state = snapshots.load().orElseGet(ReplState::new);
    }

    /** Replaces the environment with a fresh one and snapshots it. */
    public Map<String, Object> init() {
        return onWorker(() -> {
            state = new ReplState();
            save();
            logger.info("REPL initialized");
            return Map.of("success", true);
        });
    }

    /**
     * Runs {@code code}. Statements before a failing one keep their effects; the exec counter advances
     * either way.
     */
    public Map<String, Object> exec(String code) {
        return onWorker(() -> {
            var output = new ScriptOutput(MAX_OUTPUT_CHARS);
            ReplExecException failure = null;
            try {
                new Interpreter(state, functions(), output).run(code);
            } catch (ScriptException e) {
                failure = new ReplExecException(e.getMessage(), e.line());
                logger.debug("REPL exec failed: {}", failure.describe());
            } catch (RuntimeException | StackOverflowError e) {
                logger.warn("Unexpected failure while running REPL code", e);
                failure = new ReplExecException(e.getClass().getSimpleName() + ": " + e.getMessage(), 0);
            }
            state.recordExec(clock.getAsLong());
            save();

            var result = new LinkedHashMap<String, Object>();
            result.put("success", failure == null);
            result.put("output", renderOutput(output));
            result.put("variables", visibleVariables());
            if (failure != null) {
                result.put("error", failure.describe());
                result.put("code", failure.code());
            }
            putStale(result);
            return result;
        });
    }

    public Map<String, Object> status() {
        return onWorker(() -> {
            var bufferCount = new LinkedHashMap<String, Object>();
            state.buffers().forEach((key, buffer) -> bufferCount.put(key, buffer.entries().size()));
            var result = new LinkedHashMap<String, Object>();
            result.put("variables", visibleVariables());
            result.put("buffer_count", bufferCount);
            result.put("exec_count", state.execCount());
            putStale(result);
            return result;
        });
    }

    /** Clears variables, buffers and counters in one step and removes the snapshot. */
    public Map<String, Object> reset() {
        return onWorker(() -> {
            state = new ReplState();
            try {
                snapshots.delete();
            } catch (IOException e) {
                logger.warn("Could not delete REPL snapshot {}", snapshots.file(), e);
            }
            logger.info("REPL reset");
            return Map.of("success", true);
        });
    }

    public Map<String, Object> exportBuffers() {
        return onWorker(() -> {
            var buffers = new LinkedHashMap<String, Object>();
            state.buffers().forEach((key, buffer) -> buffers.put(key, buffer.entries()));
            return Map.of("buffers", buffers);
        });
    }

    private Map<String, ScriptFunction> functions() {
        var functions = new LinkedHashMap<String, ScriptFunction>(Builtins.all());
        functions.putAll(new ReplHelpers(root, chunksDir, ignoreRules, state).functions());
        return functions;
    }

    private List<String> visibleVariables() {
        var names = new ArrayList<String>();
        for (String name : state.variableNames()) {
            if (!name.startsWith("_")) {
                names.add(name);
            }
        }
        return names;
    }

    private void putStale(Map<String, Object> result) {
        var stale = staleness.check(state);
        if (!stale.isEmpty()) {
            result.put("stale", stale);
        }
    }

    private static String renderOutput(ScriptOutput output) {
        if (!output.isTruncated()) {
            return output.text();
        }
        long remaining = output.totalLength() - output.text().length();
        return output.text() + "\n... (truncated, %d more chars, ~%d tokens)".formatted(remaining, remaining / 4);
    }

    private void save() {
        try {
            snapshots.save(state);
        } catch (IOException e) {
            logger.warn("Could not write REPL snapshot {}", snapshots.file(), e);
        }
    }

    private <T> T onWorker(Callable<T> task) {
        try {
            return worker.submit(task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the REPL", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("REPL task failed", cause);
        }
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(2, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
