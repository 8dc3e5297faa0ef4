package ai.navigator.repl;

import ai.navigator.analyzer.ProjectFile;
import ai.navigator.chunk.ChunkWindows;
import ai.navigator.exception.ProtocolException;
import ai.navigator.index.IgnoreRules;
import ai.navigator.repl.script.Arguments;
import ai.navigator.repl.script.CallContext;
import ai.navigator.repl.script.ScriptException;
import ai.navigator.repl.script.ScriptFunction;
import ai.navigator.repl.script.Values;
import ai.navigator.util.FileUtil;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Codebase helpers bound into the REPL. They are the script's only way to touch the filesystem; every
 * path is resolved against the project root and every file read is reported to the calling statement
 * as a dependency.
 */
public final class ReplHelpers {
    private static final Logger logger = LogManager.getLogger(ReplHelpers.class);

    public static final int DEFAULT_GREP_RESULTS = 50;

    private final Path root;
    private final Path chunksDir;
    private final IgnoreRules ignoreRules;
    private final ReplState state;

    public ReplHelpers(Path root, Path chunksDir, IgnoreRules ignoreRules, ReplState state) {
        this.root = root;
        this.chunksDir = chunksDir;
        this.ignoreRules = ignoreRules;
        this.state = state;
    }

    public Map<String, ScriptFunction> functions() {
        var functions = new LinkedHashMap<String, ScriptFunction>();
        functions.put("peek", this::peek);
        functions.put("grep", this::grep);
        functions.put("chunk_indices", this::chunkIndices);
        functions.put("write_chunks", this::writeChunks);
        functions.put("add_buffer", this::addBuffer);
        return functions;
    }

    private String peek(CallContext ctx, Arguments args) {
        args.bind(1, "path", "start", "end");
        var path = args.string(0, "path", null);
        long start = args.integer(1, "start", 1);
        var end = args.optionalInteger(2, "end");

        var file = resolve(path, ctx);
        if (!Files.isRegularFile(file.absPath())) {
            return "Error: file not found: " + path;
        }
        var lines = readLines(file, ctx);
        long from = Math.max(1, start);
        long to = end == null ? lines.size() : Math.min(end, lines.size());
        var sb = new StringBuilder();
        for (long n = from; n <= to; n++) {
            sb.append("%4d | ".formatted(n)).append(lines.get((int) n - 1));
        }
        return sb.toString();
    }

    private String grep(CallContext ctx, Arguments args) {
        args.bind(1, "pattern", "path", "max_results");
        var patternText = args.string(0, "pattern", null);
        var path = args.string(1, "path", ".");
        long maxResults = args.integer(2, "max_results", DEFAULT_GREP_RESULTS);

        var start = resolve(path, ctx);
        if (!Files.exists(start.absPath())) {
            return "Error: path not found: " + path;
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(patternText);
        } catch (PatternSyntaxException e) {
            return "Error: invalid regex: " + e.getDescription();
        }

        var results = new ArrayList<String>();
        for (ProjectFile file : textFilesUnder(start)) {
            if (results.size() >= maxResults) {
                break;
            }
            List<String> lines;
            try {
                lines = FileUtil.splitLinesKeepEnds(
                        FileUtil.readLenient(file.absPath()));
            } catch (IOException e) {
                logger.debug("grep skipped unreadable {}: {}", file, e.getMessage());
                continue;
            }
            boolean matched = false;
            for (int i = 0; i < lines.size() && results.size() < maxResults; i++) {
                var line = FileUtil.stripLineEnding(lines.get(i));
                if (pattern.matcher(line).find()) {
                    results.add(file + ":" + (i + 1) + ":" + line.stripTrailing());
                    matched = true;
                }
            }
            if (matched) {
                FileUtil.mtimeMillis(file.absPath()).ifPresent(m -> ctx.track(new Dependency(file.toString(), m)));
            }
        }
        return results.isEmpty() ? "No matches found" : String.join("\n", results);
    }

    private List<Object> chunkIndices(CallContext ctx, Arguments args) {
        args.bind(1, "path", "size", "overlap");
        var path = args.string(0, "path", null);
        int size = args.intValue(1, "size", ChunkWindows.DEFAULT_SIZE);
        int overlap = args.intValue(2, "overlap", ChunkWindows.DEFAULT_OVERLAP);

        var file = resolve(path, ctx);
        var result = new ArrayList<Object>();
        if (!Files.isRegularFile(file.absPath())) {
            return result;
        }
        var lines = readLines(file, ctx);
        for (var window : windows(lines.size(), size, overlap, ctx)) {
            result.add(new ArrayList<Object>(List.of((long) window.start(), (long) window.end())));
        }
        return result;
    }

    private List<Object> writeChunks(CallContext ctx, Arguments args) {
        args.bind(1, "path", "out_dir", "size", "overlap");
        var path = args.string(0, "path", null);
        var outDirArg = args.get(1, "out_dir");
        int size = args.intValue(2, "size", ChunkWindows.DEFAULT_SIZE);
        int overlap = args.intValue(3, "overlap", ChunkWindows.DEFAULT_OVERLAP);

        var file = resolve(path, ctx);
        Path outDir = outDirArg == null
                ? chunksDir
                : resolve(args.string(1, "out_dir", null), ctx).absPath();
        var result = new ArrayList<Object>();
        if (!Files.isRegularFile(file.absPath())) {
            return result;
        }
        var lines = readLines(file, ctx);
        var name = file.getFileName();
        int dot = name.lastIndexOf('.');
        var stem = dot > 0 ? name.substring(0, dot) : name;
        try {
            Files.createDirectories(outDir);
            for (var window : windows(lines.size(), size, overlap, ctx)) {
                var sb = new StringBuilder("# %s lines %s\n".formatted(file, window.lines()));
                for (int n = window.start(); n <= window.end(); n++) {
                    sb.append(lines.get(n - 1));
                }
                var target = outDir.resolve("%s_chunk_%d.txt".formatted(stem, window.index()));
                Files.writeString(target, sb.toString(), StandardCharsets.UTF_8);
                result.add(FileUtil.toSlashPath(root.relativize(target)));
            }
        } catch (IOException e) {
            throw new ScriptException("OSError: " + e.getMessage(), ctx.line());
        }
        return result;
    }

    private @Nullable Object addBuffer(CallContext ctx, Arguments args) {
        args.bind(2, "key", "text");
        var key = args.string(0, "key", null);
        state.appendToBuffer(key, Values.str(args.get(1, "text")), ctx.tracked());
        return null;
    }

    private ProjectFile resolve(@Nullable String path, CallContext ctx) {
        try {
            return ProjectFile.resolve(root, path);
        } catch (ProtocolException e) {
            throw new ScriptException("PermissionError: path outside project root: " + path, ctx.line());
        }
    }

    /** Reads the file as lines with their terminators and registers it as a dependency. */
    private static List<String> readLines(ProjectFile file, CallContext ctx) {
        var mtime = FileUtil.mtimeMillis(file.absPath());
        try {
            var content = FileUtil.readLenient(file.absPath());
            mtime.ifPresent(m -> ctx.track(new Dependency(file.toString(), m)));
            return FileUtil.splitLinesKeepEnds(content);
        } catch (IOException e) {
            throw new ScriptException("OSError: cannot read %s: %s".formatted(file, e.getMessage()), ctx.line());
        }
    }

    private static List<ChunkWindows.Window> windows(int totalLines, int size, int overlap, CallContext ctx) {
        try {
            return ChunkWindows.windows(totalLines, size, overlap);
        } catch (IllegalArgumentException e) {
            throw ScriptException.value(e.getMessage(), ctx.line());
        }
    }

    private List<ProjectFile> textFilesUnder(ProjectFile start) {
        var files = new ArrayList<ProjectFile>();
        var startPath = start.absPath();
        if (Files.isRegularFile(startPath)) {
            return FileUtil.isLikelyText(startPath) ? List.of(start) : List.of();
        }
        try {
            Files.walkFileTree(startPath, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(startPath) && ignoreRules.isIgnoredDirectoryName(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()
                            && !ignoreRules.isIgnoredFileName(file.getFileName().toString())
                            && FileUtil.isLikelyText(file)) {
                        files.add(new ProjectFile(root, root.relativize(file)));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("grep could not walk {}: {}", start, e.getMessage());
        }
        files.sort(null);
        return files;
    }
}
