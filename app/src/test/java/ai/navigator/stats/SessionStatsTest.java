package ai.navigator.stats;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionStatsTest {

    private final AtomicLong now = new AtomicLong(1_000_000L);
    private final SessionStats stats = new SessionStats(now::get);

    @Test
    void testEmptySession() {
        var map = stats.toMap();

        assertEquals(0L, map.get("tool_calls"));
        assertEquals(0L, map.get("tokens_served"));
        assertEquals(0L, map.get("tokens_avoided"));
        assertEquals(0L, map.get("reduction_pct"));
        assertEquals(Map.of(), map.get("breakdown"));
    }

    @Test
    void testTotalsAndBreakdown() {
        stats.record("squeeze", 400, 3600);
        stats.record("squeeze", 400, 1600);
        stats.record("status", 200);
        now.addAndGet(61_500);

        var map = stats.toMap();

        assertEquals(3L, map.get("tool_calls"));
        assertEquals(250L, map.get("tokens_served"));
        assertEquals(1300L, map.get("tokens_avoided"));
        // 5200 of 6200 bytes avoided
        assertEquals(84L, map.get("reduction_pct"));
        assertEquals(62L, map.get("duration_s"));

        @SuppressWarnings("unchecked")
        var breakdown = (Map<String, Map<String, Object>>) map.get("breakdown");
        assertEquals(Map.of("calls", 2L, "tokens_served", 200L, "tokens_avoided", 1300L), breakdown.get("squeeze"));
        assertEquals(Map.of("calls", 1L, "tokens_served", 50L), breakdown.get("status"));
    }

    @Test
    void testNegativeAvoidedBytesAreClamped() {
        stats.record("search", 1000, -500);

        assertEquals(0L, stats.toMap().get("tokens_avoided"));
        assertEquals(1L, stats.toolCalls());
    }

    @Test
    void testAppendSessionLog(@TempDir Path rlmDir) throws Exception {
        stats.record("find", 80, 920);
        stats.appendSessionLog(rlmDir, "/work/project");
        stats.appendSessionLog(rlmDir, "/work/project");

        var lines = Files.readAllLines(rlmDir.resolve(SessionStats.SESSION_LOG));
        assertEquals(2, lines.size());
        var entry = new ObjectMapper().readTree(lines.get(0));
        assertEquals("/work/project", entry.get("root").asText());
        assertEquals(1, entry.get("tool_calls").asInt());
        assertEquals(230, entry.get("tokens_avoided").asInt());
        assertTrue(entry.has("ended_at"));
    }
}
