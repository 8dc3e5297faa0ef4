package ai.navigator.server;

import ai.navigator.DaemonContext;
import ai.navigator.analyzer.ProjectFile;
import ai.navigator.analyzer.Symbol;
import ai.navigator.exception.NavigatorException;
import ai.navigator.exception.ProtocolException;
import ai.navigator.index.DirectoryTree;
import ai.navigator.index.SymbolLookup;
import ai.navigator.util.FileUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Routes one decoded request to its handler and renders the JSON response. Never throws: every failure
 * becomes an {@link ErrorPayload}. Each call is counted in the session stats together with the bytes it
 * served and, for the navigation actions, the bytes the client did not have to read.
 */
public final class RequestDispatcher {
    private static final Logger logger = LogManager.getLogger(RequestDispatcher.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final Set<String> ACTIONS = Set.of(
            "status", "tree", "squeeze", "find", "search", "chunks_list", "chunks_read",
            "repl_init", "repl_exec", "repl_status", "repl_reset", "repl_export_buffers");
    private static final String INVALID = "invalid";

    private final DaemonContext context;

    public RequestDispatcher(DaemonContext context) {
        this.context = context;
    }

    /**
     * Handler result before serialization.
     *
     * @param extraServed bytes the client will read as a consequence of this answer
     * @param avoided bytes saved, as a function of the serialized response size
     */
    private record Reply(Object body, long extraServed, AvoidedBytes avoided) {
        static Reply of(Object body) {
            return new Reply(body, 0, responseSize -> 0);
        }

        static Reply of(Object body, AvoidedBytes avoided) {
            return new Reply(body, 0, avoided);
        }
    }

    @FunctionalInterface
    private interface AvoidedBytes {
        long compute(long responseSize);
    }

    public byte[] dispatch(JsonNode request) {
        String action = INVALID;
        try {
            if (!request.isObject()) {
                throw new ProtocolException("Request must be a JSON object");
            }
            var actionNode = request.get("action");
            if (actionNode == null || !actionNode.isTextual()) {
                throw new ProtocolException("Missing 'action'");
            }
            if (!ACTIONS.contains(actionNode.asText())) {
                throw new ProtocolException("Unknown action: " + actionNode.asText());
            }
            action = actionNode.asText();
            if (context.isRootLost()) {
                return render(action, Reply.of(ErrorPayload.of(
                        ErrorPayload.Code.ROOT_MISSING, "Project root no longer exists: " + context.root())));
            }
            return render(action, handle(action, request));
        } catch (NavigatorException e) {
            logger.debug("{} failed: {}", action, e.getMessage());
            return render(action, Reply.of(ErrorPayload.from(e)));
        } catch (RuntimeException e) {
            logger.error("Unhandled exception in handler for {}", action, e);
            return render(action, Reply.of(ErrorPayload.internalError(e)));
        }
    }

    /** Renders an error that happened before a request could be decoded. */
    public byte[] reject(NavigatorException e) {
        return render(INVALID, Reply.of(ErrorPayload.from(e)));
    }

    private Reply handle(String action, JsonNode request) {
        return switch (action) {
            case "status" -> status();
            case "tree" -> tree(request);
            case "squeeze" -> squeeze(request);
            case "find" -> find(request);
            case "search" -> search(request);
            case "chunks_list" -> chunksList(request);
            case "chunks_read" -> chunksRead(request);
            case "repl_init" -> Reply.of(context.repl().init());
            case "repl_exec" -> Reply.of(context.repl().exec(requiredString(request, "code")));
            case "repl_status" -> Reply.of(context.repl().status());
            case "repl_reset" -> Reply.of(context.repl().reset());
            case "repl_export_buffers" -> Reply.of(context.repl().exportBuffers());
            default -> throw new ProtocolException("Unknown action: " + action);
        };
    }

    private Reply status() {
        var body = new LinkedHashMap<String, Object>();
        body.put("status", "alive");
        body.put("root", context.root().toString());
        body.put("cache_size", context.cache().size());
        body.put("languages", context.cache().extractor().supportedLanguages());
        body.put("session", context.stats().toMap());
        return Reply.of(body);
    }

    private Reply tree(JsonNode request) {
        var dir = resolve(optionalString(request, "path"));
        int maxDepth = optionalInt(request, "max_depth", DirectoryTree.DEFAULT_MAX_DEPTH);
        return Reply.of(Map.of("tree", context.tree().list(dir, maxDepth)));
    }

    private Reply squeeze(JsonNode request) {
        var file = resolve(requiredString(request, "path"));
        var record = context.cache().get(file);
        long skeletonBytes = record.skeleton().getBytes(StandardCharsets.UTF_8).length;
        return Reply.of(Map.of("skeleton", record.skeleton()), responseSize -> record.size() - skeletonBytes);
    }

    private Reply find(JsonNode request) {
        var file = resolve(requiredString(request, "path"));
        var name = requiredString(request, "symbol");
        var record = context.cache().get(file);
        var match = SymbolLookup.find(record, name);

        var body = new LinkedHashMap<String, Object>();
        body.put("start_line", match.symbol().startLine());
        body.put("end_line", match.symbol().endLine());
        if (match.ambiguous()) {
            body.put("ambiguous", true);
            var candidates = new ArrayList<Map<String, Object>>();
            for (Symbol candidate : match.candidates()) {
                candidates.add(Map.of("start_line", candidate.startLine(), "end_line", candidate.endLine()));
            }
            body.put("candidates", candidates);
        }
        long spanBytes = spanBytes(file, match.symbol());
        // the client reads the drilled span next, so it counts as served
        return new Reply(body, spanBytes, responseSize -> record.size() - spanBytes);
    }

    private Reply search(JsonNode request) {
        var query = requiredString(request, "query");
        var subtree = resolve(optionalString(request, "path"));
        var result = context.search().search(query, subtree);
        var results = new ArrayList<Map<String, Object>>();
        for (var hit : result.hits()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("path", hit.path());
            entry.put("matches", hit.matches());
            results.add(entry);
        }
        return Reply.of(Map.of("results", results), responseSize -> result.matchedBytes() - responseSize);
    }

    private Reply chunksList(JsonNode request) {
        var file = resolve(requiredString(request, "path"));
        var manifest = context.chunkStore().manifest(file);
        if (manifest.isEmpty()) {
            return Reply.of(Map.of("status", "pending"));
        }
        var body = new LinkedHashMap<String, Object>();
        body.put("status", "ready");
        body.put("manifest", manifest.get());
        return Reply.of(body);
    }

    private Reply chunksRead(JsonNode request) {
        var file = resolve(requiredString(request, "path"));
        int index = optionalInt(request, "chunk", 0);
        var chunk = context.chunkStore().read(file, index);
        if (chunk.isEmpty()) {
            return Reply.of(Map.of("status", "pending"));
        }
        var c = chunk.get();
        var body = new LinkedHashMap<String, Object>();
        body.put("chunk", index);
        body.put("total_chunks", c.totalChunks());
        body.put("lines", c.window().lines());
        body.put("content", c.content());
        long fileSize = sizeOf(file);
        long contentBytes = c.content().getBytes(StandardCharsets.UTF_8).length;
        return Reply.of(body, responseSize -> fileSize - contentBytes);
    }

    private byte[] render(String action, Reply reply) {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(reply.body());
        } catch (JsonProcessingException e) {
            logger.error("Could not serialize response for {}", action, e);
            bytes = "{\"error\":\"Internal error: response not serializable\",\"code\":\"INTERNAL_ERROR\"}"
                    .getBytes(StandardCharsets.UTF_8);
            context.stats().record(action, bytes.length);
            return bytes;
        }
        long served = bytes.length + reply.extraServed();
        context.stats().record(action, served, reply.avoided().compute(bytes.length));
        return bytes;
    }

    private ProjectFile resolve(@Nullable String path) {
        return ProjectFile.resolve(context.root(), path);
    }

    private long spanBytes(ProjectFile file, Symbol symbol) {
        try {
            var lines = FileUtil.splitLinesKeepEnds(
                    FileUtil.readLenient(file.absPath()));
            long bytes = 0;
            for (int i = symbol.startLine() - 1; i < Math.min(symbol.endLine(), lines.size()); i++) {
                bytes += lines.get(i).getBytes(StandardCharsets.UTF_8).length;
            }
            return bytes;
        } catch (IOException e) {
            logger.debug("Could not measure span of {} in {}: {}", symbol.name(), file, e.getMessage());
            return 0;
        }
    }

    private static long sizeOf(ProjectFile file) {
        try {
            return Files.size(file.absPath());
        } catch (IOException e) {
            return 0;
        }
    }

    private static String requiredString(JsonNode request, String field) {
        var value = optionalString(request, field);
        if (value == null) {
            throw new ProtocolException("Missing '%s'".formatted(field));
        }
        return value;
    }

    private static @Nullable String optionalString(JsonNode request, String field) {
        var node = request.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ProtocolException("Field '%s' must be a string".formatted(field));
        }
        return node.asText();
    }

    private static int optionalInt(JsonNode request, String field, int defaultValue) {
        var node = request.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new ProtocolException("Field '%s' must be an integer".formatted(field));
        }
        return node.intValue();
    }
}
