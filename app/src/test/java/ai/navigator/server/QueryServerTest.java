package ai.navigator.server;

import static org.junit.jupiter.api.Assertions.*;

import ai.navigator.DaemonConfig;
import ai.navigator.DaemonContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QueryServerTest {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path root;
    private DaemonContext context;
    private QueryServer server;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createDirectories(tempDir.resolve("project"));
        Files.createDirectories(root.resolve("pkg"));
        Files.writeString(root.resolve("pkg/mod.py"), """
                import os


                def foo(x):
                    return x + 1


                class Calc:
                    def add(self, a, b):
                        return a + b
                """);
        Files.writeString(root.resolve("notes.txt"), "plain text\n");
        context = new DaemonContext(DaemonConfig.forRoot(root));
        server = new QueryServer(context);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        context.close();
    }

    /** Sends the request, half-closes, and returns everything the server wrote. */
    private String send(String request) throws Exception {
        try (var socket = new Socket(InetAddress.getLoopbackAddress(), server.getPort())) {
            socket.setSoTimeout(10_000);
            socket.getOutputStream().write(request.getBytes(StandardCharsets.UTF_8));
            socket.getOutputStream().flush();
            socket.shutdownOutput();
            return readAll(socket.getInputStream());
        }
    }

    private JsonNode query(String request) throws Exception {
        return objectMapper.readTree(send(request));
    }

    private static String readAll(InputStream in) throws Exception {
        var out = new ByteArrayOutputStream();
        in.transferTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testEmptyConnectionIsLivenessProbe() throws Exception {
        assertEquals("ALIVE", send(""));
        assertEquals("ALIVE", send("  \n"));
    }

    @Test
    void testCompleteRequestIsAnsweredWithoutHalfClose() throws Exception {
        try (var socket = new Socket(InetAddress.getLoopbackAddress(), server.getPort())) {
            socket.setSoTimeout(10_000);
            var out = socket.getOutputStream();
            out.write("{\"action\": ".getBytes(StandardCharsets.UTF_8));
            out.flush();
            Thread.sleep(50);
            out.write("\"status\"}".getBytes(StandardCharsets.UTF_8));
            out.flush();

            var response = objectMapper.readTree(readAll(socket.getInputStream()));
            assertEquals("alive", response.get("status").asText());
        }
    }

    @Test
    void testStatus() throws Exception {
        var response = query("{\"action\": \"status\"}");

        assertEquals("alive", response.get("status").asText());
        assertEquals(root.toRealPath().toString(), response.get("root").asText());
        assertTrue(response.get("languages").isArray());
        assertTrue(response.get("session").has("tool_calls"));
    }

    @Test
    void testSqueezeFindSearch() throws Exception {
        var squeeze = query("{\"action\": \"squeeze\", \"path\": \"pkg/mod.py\"}");
        var skeleton = squeeze.get("skeleton").asText();
        assertTrue(skeleton.contains("def foo(x):"), skeleton);
        assertTrue(skeleton.contains("class Calc"), skeleton);
        assertFalse(skeleton.contains("return x + 1"), skeleton);

        var find = query("{\"action\": \"find\", \"path\": \"pkg/mod.py\", \"symbol\": \"foo\"}");
        assertEquals(4, find.get("start_line").asInt());
        assertEquals(5, find.get("end_line").asInt());
        assertFalse(find.has("ambiguous"));

        var method = query("{\"action\": \"find\", \"path\": \"pkg/mod.py\", \"symbol\": \"Calc.add\"}");
        assertEquals(9, method.get("start_line").asInt());
        assertEquals(10, method.get("end_line").asInt());

        var search = query("{\"action\": \"search\", \"query\": \"foo\"}");
        var results = search.get("results");
        assertEquals(1, results.size());
        assertEquals("pkg/mod.py", results.get(0).get("path").asText());
        assertTrue(results.get(0).get("matches").get(0).asText().contains("def foo"));

        var session = query("{\"action\": \"status\"}").get("session");
        assertEquals(4, session.get("tool_calls").asInt());
        assertTrue(session.get("tokens_avoided").asLong() > 0);
        assertEquals(2, session.get("breakdown").get("find").get("calls").asInt());
    }

    @Test
    void testTree() throws Exception {
        var tree = query("{\"action\": \"tree\"}").get("tree");

        assertEquals("pkg", tree.get(0).get("name").asText());
        assertEquals("directory", tree.get(0).get("type").asText());
        assertEquals("notes.txt", tree.get(1).get("name").asText());
    }

    @Test
    void testMissingFileAndSymbol() throws Exception {
        var missing = query("{\"action\": \"squeeze\", \"path\": \"nope.py\"}");
        assertEquals("NOT_FOUND", missing.get("code").asText());
        assertEquals("File not found: nope.py", missing.get("error").asText());

        var symbol = query("{\"action\": \"find\", \"path\": \"pkg/mod.py\", \"symbol\": \"bar\"}");
        assertEquals("NOT_FOUND", symbol.get("code").asText());
    }

    @Test
    void testProtocolErrors() throws Exception {
        var invalid = query("{\"action\": ");
        assertEquals("BAD_REQUEST", invalid.get("code").asText());
        assertTrue(invalid.get("error").asText().startsWith("Invalid JSON"));

        var garbage = query("not json at all}");
        assertEquals("BAD_REQUEST", garbage.get("code").asText());

        var unknown = query("{\"action\": \"explode\"}");
        assertEquals("BAD_REQUEST", unknown.get("code").asText());
        assertEquals("Unknown action: explode", unknown.get("error").asText());

        var missingField = query("{\"action\": \"squeeze\"}");
        assertEquals("Missing 'path'", missingField.get("error").asText());

        var wrongType = query("{\"action\": \"tree\", \"max_depth\": \"deep\"}");
        assertEquals("BAD_REQUEST", wrongType.get("code").asText());

        var notObject = query("[1, 2]");
        assertEquals("BAD_REQUEST", notObject.get("code").asText());

        var stats = query("{\"action\": \"status\"}").get("session").get("breakdown");
        assertEquals(4, stats.get("invalid").get("calls").asInt());
    }

    @Test
    void testPathTraversalIsRejected() throws Exception {
        Files.writeString(tempDir.resolve("secret.txt"), "secret\n");

        var response = query("{\"action\": \"squeeze\", \"path\": \"../secret.txt\"}");

        assertEquals("BAD_REQUEST", response.get("code").asText());
        assertTrue(response.get("error").asText().startsWith("Path outside project root"));
        assertFalse(response.toString().contains("secret\\n"));
    }

    @Test
    void testChunks() throws Exception {
        var sb = new StringBuilder();
        for (int i = 1; i <= 450; i++) {
            sb.append("row ").append(i).append('\n');
        }
        Files.writeString(root.resolve("data.txt"), sb.toString());

        var list = query("{\"action\": \"chunks_list\", \"path\": \"data.txt\"}");
        assertEquals("ready", list.get("status").asText());
        assertEquals(3, list.get("manifest").get("total_chunks").asInt());
        assertEquals(450, list.get("manifest").get("total_lines").asInt());

        var read = query("{\"action\": \"chunks_read\", \"path\": \"data.txt\", \"chunk\": 2}");
        assertEquals(2, read.get("chunk").asInt());
        assertEquals(3, read.get("total_chunks").asInt());
        assertEquals("361-450", read.get("lines").asText());
        assertTrue(read.get("content").asText().startsWith("# data.txt lines 361-450\nrow 361\n"));

        var outOfRange = query("{\"action\": \"chunks_read\", \"path\": \"data.txt\", \"chunk\": 3}");
        assertEquals("NOT_FOUND", outOfRange.get("code").asText());
    }

    @Test
    void testReplRoundTrip() throws Exception {
        assertTrue(query("{\"action\": \"repl_init\"}").get("success").asBoolean());

        var exec = query("{\"action\": \"repl_exec\", \"code\": \"src = peek('pkg/mod.py', 4, 5)\\nprint(len(src) > 0)\"}");
        assertTrue(exec.get("success").asBoolean());
        assertEquals("True\n", exec.get("output").asText());
        assertEquals("src", exec.get("variables").get(0).asText());

        var failed = query("{\"action\": \"repl_exec\", \"code\": \"x = nope\"}");
        assertFalse(failed.get("success").asBoolean());
        assertTrue(failed.get("error").asText().contains("NameError"));
        assertEquals("REPL_ERROR", failed.get("code").asText());

        var status = query("{\"action\": \"repl_status\"}");
        assertEquals(2, status.get("exec_count").asInt());

        assertTrue(query("{\"action\": \"repl_reset\"}").get("success").asBoolean());
        assertEquals(0, query("{\"action\": \"repl_status\"}").get("exec_count").asInt());
        assertTrue(query("{\"action\": \"repl_export_buffers\"}").get("buffers").isEmpty());
    }

    @Test
    void testRootLossAnswersEveryAction() throws Exception {
        context.markRootLost();

        var response = query("{\"action\": \"status\"}");

        assertEquals("ROOT_MISSING", response.get("code").asText());
        assertEquals("ROOT_MISSING", query("{\"action\": \"squeeze\", \"path\": \"pkg/mod.py\"}").get("code").asText());
        assertEquals("ALIVE", send(""));
    }

    @Test
    void testConcurrentClients() throws Exception {
        var threads = new Thread[8];
        var failures = new AtomicInteger();
        for (int i = 0; i < threads.length; i++) {
            threads[i] = new Thread(() -> {
                try {
                    var response = query("{\"action\": \"squeeze\", \"path\": \"pkg/mod.py\"}");
                    if (!response.has("skeleton")) {
                        failures.incrementAndGet();
                    }
                } catch (Exception e) {
                    failures.incrementAndGet();
                }
            });
            threads[i].start();
        }
        for (Thread t : threads) {
            t.join(15_000);
        }
        assertEquals(0, failures.get());
    }
}
