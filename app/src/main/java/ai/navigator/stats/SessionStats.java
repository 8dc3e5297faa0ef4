package ai.navigator.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.LongSupplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Per-action call and byte counters for the daemon's lifetime. Tokens are estimated as bytes / 4.
 *
 * <p>Thread-safe: every method synchronizes on the instance.
 */
public final class SessionStats {
    private static final Logger logger = LogManager.getLogger(SessionStats.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String SESSION_LOG = "sessions.jsonl";

    private final LongSupplier clock;
    private final long startedAt;
    private long toolCalls;
    private long bytesServed;
    private long bytesAvoided;
    private final Map<String, Counter> perAction = new TreeMap<>();

    private static final class Counter {
        long calls;
        long bytesServed;
        long bytesAvoided;
    }

    public SessionStats() {
        this(System::currentTimeMillis);
    }

    SessionStats(LongSupplier clock) {
        this.clock = clock;
        this.startedAt = clock.getAsLong();
    }

    public synchronized void record(String action, long servedBytes, long avoidedBytes) {
        long avoided = Math.max(0, avoidedBytes);
        toolCalls++;
        bytesServed += servedBytes;
        bytesAvoided += avoided;
        var counter = perAction.computeIfAbsent(action, k -> new Counter());
        counter.calls++;
        counter.bytesServed += servedBytes;
        counter.bytesAvoided += avoided;
    }

    public void record(String action, long servedBytes) {
        record(action, servedBytes, 0);
    }

    public synchronized long toolCalls() {
        return toolCalls;
    }

    public synchronized Map<String, Object> toMap() {
        long total = bytesServed + bytesAvoided;
        long reductionPct = total > 0 ? Math.round(bytesAvoided * 100.0 / total) : 0;
        var breakdown = new LinkedHashMap<String, Object>();
        perAction.forEach((action, c) -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("calls", c.calls);
            entry.put("tokens_served", c.bytesServed / 4);
            if (c.bytesAvoided > 0) {
                entry.put("tokens_avoided", c.bytesAvoided / 4);
            }
            breakdown.put(action, entry);
        });

        var result = new LinkedHashMap<String, Object>();
        result.put("tool_calls", toolCalls);
        result.put("tokens_served", bytesServed / 4);
        result.put("tokens_avoided", bytesAvoided / 4);
        result.put("reduction_pct", reductionPct);
        result.put("duration_s", Math.round((clock.getAsLong() - startedAt) / 1000.0));
        result.put("breakdown", breakdown);
        return result;
    }

    /** Appends the final stats as one JSON line to {@code <rlmDir>/sessions.jsonl}. */
    public void appendSessionLog(Path rlmDir, String root) throws IOException {
        var entry = new LinkedHashMap<String, Object>(toMap());
        entry.put("root", root);
        entry.put("ended_at", Instant.ofEpochMilli(clock.getAsLong()).toString());
        var line = objectMapper.writeValueAsString(entry) + "\n";
        Files.createDirectories(rlmDir);
        Files.write(
                rlmDir.resolve(SESSION_LOG),
                line.getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND);
        logger.debug("Appended session stats to {}", rlmDir.resolve(SESSION_LOG));
    }
}
