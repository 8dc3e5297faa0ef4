package ai.navigator.repl;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReplSnapshotStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testRoundTripPreservesValuesDependenciesAndCounters() throws Exception {
        var store = new ReplSnapshotStore(tempDir.resolve("repl/state.json"));
        var state = new ReplState();
        var dep = new Dependency("src/a.py", 1_700_000_000_123L);
        var nested = new LinkedHashMap<Object, Object>();
        nested.put("count", 3L);
        nested.put("ratio", 0.25);
        var list = new ArrayList<Object>(List.of("text", 7L, false));
        list.add(null);
        state.setVariable("nested", nested, Set.of(dep));
        state.setVariable("items", list, Set.of());
        state.appendToBuffer("findings", "first", Set.of(dep));
        state.appendToBuffer("findings", "second", Set.of());
        state.recordExec(42L);
        state.recordExec(43L);

        store.save(state);
        var restored = store.load().orElseThrow();

        assertEquals(Map.of("count", 3L, "ratio", 0.25), restored.variable("nested").value());
        assertEquals(Set.of(dep), restored.variable("nested").dependencies());
        assertEquals(list, restored.variable("items").value());
        assertEquals(List.of("first", "second"), restored.buffers().get("findings").entries());
        assertEquals(Set.of(dep), restored.buffers().get("findings").dependencies());
        assertEquals(2L, restored.execCount());
        assertEquals(43L, restored.lastExec());
        assertEquals(List.of("nested", "items"), restored.variableNames());
    }

    @Test
    void testNonStringDictKeysComeBackAsStrings() throws Exception {
        var store = new ReplSnapshotStore(tempDir.resolve("state.json"));
        var state = new ReplState();
        var map = new LinkedHashMap<Object, Object>();
        map.put(1L, "one");
        state.setVariable("m", map, Set.of());

        store.save(state);

        assertEquals(Map.of("1", "one"), store.load().orElseThrow().variable("m").value());
    }

    @Test
    void testMissingSnapshot() {
        assertTrue(new ReplSnapshotStore(tempDir.resolve("absent.json")).load().isEmpty());
    }

    @Test
    void testVersionMismatchIsDiscarded() throws Exception {
        var file = tempDir.resolve("state.json");
        Files.writeString(file, "{\"format_version\": 99, \"exec_count\": 5, \"variables\": {}, \"buffers\": {}}");

        assertTrue(new ReplSnapshotStore(file).load().isEmpty());
    }

    @Test
    void testCorruptSnapshotIsDiscarded() throws Exception {
        var file = tempDir.resolve("state.json");
        Files.writeString(file, "{\"format_version\": 1, \"variables\": ");

        assertTrue(new ReplSnapshotStore(file).load().isEmpty());
    }

    @Test
    void testDelete() throws Exception {
        var store = new ReplSnapshotStore(tempDir.resolve("state.json"));
        store.save(new ReplState());
        assertTrue(Files.exists(store.file()));

        store.delete();

        assertFalse(Files.exists(store.file()));
        store.delete();
    }
}
