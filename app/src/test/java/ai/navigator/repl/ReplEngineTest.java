package ai.navigator.repl;

import static org.junit.jupiter.api.Assertions.*;

import ai.navigator.index.IgnoreRules;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReplEngineTest {

    @TempDir
    Path root;

    private ReplEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(root.resolve("a.py"), "def foo():\n    return 1\n\n\ndef bar():\n    return 2\n");
        engine = new ReplEngine(root, IgnoreRules.defaults(), () -> 1_700_000_000_000L);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private void bumpMtime(Path path) throws Exception {
        var mtime = Files.getLastModifiedTime(path).toMillis();
        Files.setLastModifiedTime(path, FileTime.fromMillis(mtime + 2000));
    }

    @Test
    void testExecCapturesOutputAndVariables() {
        var result = engine.exec("x = 40 + 2\nprint(x)\n_hidden = 1\n");

        assertEquals(true, result.get("success"));
        assertEquals("42\n", result.get("output"));
        assertEquals(List.of("x"), result.get("variables"));
        assertFalse(result.containsKey("error"));
        assertFalse(result.containsKey("code"));
        assertFalse(result.containsKey("stale"));
    }

    @Test
    void testStateSurvivesAcrossExecs() {
        engine.exec("items = [1, 2]");
        var result = engine.exec("items.append(3)\nprint(sum(items))");

        assertEquals("6\n", result.get("output"));
        assertEquals(2L, engine.status().get("exec_count"));
    }

    @Test
    void testPeekNumbersLinesAndTracksFile() {
        var result = engine.exec("src = peek('a.py', 1, 2)\nprint(src, end='')");

        assertEquals("   1 | def foo():\n   2 |     return 1\n", result.get("output"));
    }

    @Test
    void testStalenessLifecycle() throws Exception {
        engine.exec("src = peek('a.py', 1, 10)\nlabel = 'independent'");
        assertFalse(engine.status().containsKey("stale"));

        bumpMtime(root.resolve("a.py"));

        var status = engine.status();
        @SuppressWarnings("unchecked")
        var stale = (Map<String, Object>) status.get("stale");
        assertNotNull(stale, "modified file should mark dependent variables stale");
        @SuppressWarnings("unchecked")
        var variables = (Map<String, Object>) stale.get("variables");
        assertEquals(List.of(Map.of("path", "a.py", "reason", "modified")), variables.get("src"));
        assertFalse(variables.containsKey("label"));

        // rebinding from the new content clears staleness
        engine.exec("src = peek('a.py')");
        assertFalse(engine.status().containsKey("stale"));

        Files.delete(root.resolve("a.py"));
        @SuppressWarnings("unchecked")
        var deleted = (Map<String, Map<String, Object>>) engine.status().get("stale");
        assertEquals(List.of(Map.of("path", "a.py", "reason", "deleted")), deleted.get("variables").get("src"));

        engine.reset();
        assertFalse(engine.status().containsKey("stale"));
        assertEquals(List.of(), engine.status().get("variables"));
    }

    @Test
    void testBufferStaleness() throws Exception {
        engine.exec("add_buffer('notes', peek('a.py', 1, 1))\nadd_buffer('notes', 'second')");

        assertEquals(Map.of("notes", 2), engine.status().get("buffer_count"));
        @SuppressWarnings("unchecked")
        var buffers = (Map<String, Object>) engine.exportBuffers().get("buffers");
        assertEquals(List.of("   1 | def foo():\n", "second"), buffers.get("notes"));

        bumpMtime(root.resolve("a.py"));
        @SuppressWarnings("unchecked")
        var stale = (Map<String, Map<String, Object>>) engine.status().get("stale");
        assertTrue(stale.get("buffers").containsKey("notes"));
    }

    @Test
    void testErrorKeepsEarlierEffects() {
        var result = engine.exec("a = 1\nb = 1 / 0\nc = 3");

        assertEquals(false, result.get("success"));
        assertEquals("Error on line 2: ZeroDivisionError: division by zero", result.get("error"));
        assertEquals("REPL_ERROR", result.get("code"));
        assertEquals(List.of("a"), result.get("variables"));
        assertEquals(1L, engine.status().get("exec_count"));
    }

    @Test
    void testOutputIsTruncated() {
        var result = engine.exec("print('x' * 10000, end='')");

        var output = (String) result.get("output");
        assertTrue(output.startsWith("x".repeat(ReplEngine.MAX_OUTPUT_CHARS)));
        assertTrue(output.endsWith("\n... (truncated, 2000 more chars, ~500 tokens)"), output);
    }

    @Test
    void testGrepFindsMatchesAcrossFiles() throws Exception {
        Files.createDirectories(root.resolve("pkg"));
        Files.writeString(root.resolve("pkg/b.py"), "import os\n\ndef foo_helper():\n    pass\n");
        Files.createDirectories(root.resolve("node_modules"));
        Files.writeString(root.resolve("node_modules/c.py"), "def foo(): pass\n");

        var result = engine.exec("print(grep('def foo'))\nprint(grep('nothing_here'))");

        assertEquals("a.py:1:def foo():\npkg/b.py:3:def foo_helper():\nNo matches found\n", result.get("output"));
    }

    @Test
    void testGrepErrorsAreReturnedAsText() {
        var result = engine.exec("print(grep('(unclosed'))\nprint(grep('x', 'missing_dir'))");

        var output = (String) result.get("output");
        assertTrue(output.contains("Error: invalid regex: "), output);
        assertTrue(output.contains("Error: path not found: missing_dir"), output);
    }

    @Test
    void testChunkHelpers() throws Exception {
        var sb = new StringBuilder();
        for (int i = 1; i <= 450; i++) {
            sb.append("line ").append(i).append('\n');
        }
        Files.writeString(root.resolve("long.txt"), sb.toString());

        var result = engine.exec("idx = chunk_indices('long.txt')\nprint(idx)\nfiles = write_chunks('long.txt')\nprint(files)");

        assertEquals(
                "[[1, 200], [181, 380], [361, 450]]\n"
                        + "['.rlm/repl/chunks/long_chunk_0.txt', '.rlm/repl/chunks/long_chunk_1.txt', "
                        + "'.rlm/repl/chunks/long_chunk_2.txt']\n",
                result.get("output"));
        var chunk = Files.readString(root.resolve(".rlm/repl/chunks/long_chunk_1.txt"));
        assertTrue(chunk.startsWith("# long.txt lines 181-380\nline 181\n"));
    }

    @Test
    void testWriteChunksIntoChosenDirectory() throws Exception {
        var sb = new StringBuilder();
        for (int i = 1; i <= 150; i++) {
            sb.append("row ").append(i).append('\n');
        }
        Files.writeString(root.resolve("rows.txt"), sb.toString());

        var result = engine.exec("print(write_chunks('rows.txt', 'out', 100))");

        assertEquals(true, result.get("success"), String.valueOf(result.get("error")));
        assertEquals("['out/rows_chunk_0.txt', 'out/rows_chunk_1.txt']\n", result.get("output"));
        var second = Files.readString(root.resolve("out/rows_chunk_1.txt"));
        assertTrue(second.startsWith("# rows.txt lines 81-150\nrow 81\n"), second);
        assertFalse(Files.exists(root.resolve(".rlm/repl/chunks/rows_chunk_0.txt")));
    }

    @Test
    void testWriteChunksRejectsOutputDirectoryOutsideRoot() throws Exception {
        Files.writeString(root.resolve("rows.txt"), "row 1\n");

        var result = engine.exec("write_chunks('rows.txt', out_dir='../elsewhere')");

        assertEquals(false, result.get("success"));
        assertTrue(((String) result.get("error")).contains("PermissionError"), (String) result.get("error"));
    }

    @Test
    void testOversizedChunkParametersAreValueErrors() throws Exception {
        Files.writeString(root.resolve("rows.txt"), "row 1\n");

        var result = engine.exec("chunk_indices('rows.txt', 4294967496)");

        assertEquals(false, result.get("success"));
        assertTrue(((String) result.get("error")).contains("ValueError"), (String) result.get("error"));
    }

    @Test
    void testPathsOutsideRootAreRejected() {
        var result = engine.exec("x = peek('../outside.txt')");

        assertEquals(false, result.get("success"));
        assertTrue(((String) result.get("error")).contains("PermissionError"));
    }

    @Test
    void testSymlinkOutOfRootIsRejected(@TempDir Path elsewhere) throws Exception {
        Files.writeString(elsewhere.resolve("secret.txt"), "token\n");
        Files.createSymbolicLink(root.resolve("escape"), elsewhere);

        var result = engine.exec("x = peek('escape/secret.txt')");

        assertEquals(false, result.get("success"));
        assertTrue(((String) result.get("error")).contains("PermissionError"), (String) result.get("error"));
    }

    @Test
    void testMissingFileIsReportedInline() {
        var result = engine.exec("print(peek('nope.py'))");

        assertEquals(true, result.get("success"));
        assertEquals("Error: file not found: nope.py\n", result.get("output"));
    }

    @Test
    void testInitReplacesEnvironment() {
        engine.exec("x = 1");

        assertEquals(Map.of("success", true), engine.init());
        assertEquals(List.of(), engine.status().get("variables"));
    }

    @Test
    void testSnapshotRestoredByNewEngine() {
        engine.exec("x = {'k': [1, 2.5, 'three', None, True]}\nadd_buffer('b', 'entry')");
        engine.close();

        engine = new ReplEngine(root, IgnoreRules.defaults(), () -> 0L);
        var result = engine.exec("print(x['k'])");

        assertEquals("[1, 2.5, 'three', None, True]\n", result.get("output"));
        assertEquals(Map.of("b", 1), engine.status().get("buffer_count"));
        assertEquals(2L, engine.status().get("exec_count"));
    }

    @Test
    void testResetRemovesSnapshot() {
        engine.exec("x = 1");
        assertTrue(Files.exists(root.resolve(".rlm/repl/state.json")));

        engine.reset();

        assertFalse(Files.exists(root.resolve(".rlm/repl/state.json")));
        assertEquals(0L, engine.status().get("exec_count"));
    }
}
