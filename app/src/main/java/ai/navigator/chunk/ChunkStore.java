package ai.navigator.chunk;

import ai.navigator.analyzer.ProjectFile;
import ai.navigator.exception.NavigatorException;
import ai.navigator.exception.NotFoundException;
import ai.navigator.exception.ProtocolException;
import ai.navigator.index.IgnoreRules;
import ai.navigator.util.FileUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Disk-backed chunk files, one directory per source file mirroring the project tree:
 *
 * <ul>
 *   <li>{chunksDir}/{rel path}/manifest.json</li>
 *   <li>{chunksDir}/{rel path}/chunk_000.txt, chunk_001.txt, ...</li>
 * </ul>
 *
 * <p>Each generation writes a complete temp directory and renames it into place, so readers see either
 * the old set or the new one. Concurrent requests for the same file share one generation.
 */
public final class ChunkStore {
    private static final Logger logger = LogManager.getLogger(ChunkStore.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final long SYNC_GENERATION_LIMIT_BYTES = 256 * 1024;
    private static final String MANIFEST = "manifest.json";

    private final Path root;
    private final Path chunksDir;
    private final int chunkSize;
    private final int overlap;
    private final ExecutorService executor;
    private final ConcurrentHashMap<ProjectFile, CompletableFuture<ChunkManifest>> inFlight =
            new ConcurrentHashMap<>();

    public ChunkStore(Path root, Path chunksDir, int chunkSize, int overlap, ExecutorService executor) {
        ChunkWindows.validate(chunkSize, overlap);
        this.root = root;
        this.chunksDir = chunksDir;
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        this.executor = executor;
    }

    /**
     * @param window line range of the chunk
     * @param content chunk text including its header line
     */
    public record Chunk(int totalChunks, ChunkWindows.Window window, String content) {}

    /**
     * Returns the current manifest, generating chunks first when they are missing or stale. Small files are
     * generated on the calling thread; for large ones generation is queued and empty is returned.
     *
     * @throws NotFoundException if the file does not exist
     * @throws ProtocolException if the file is not text
     */
    public Optional<ChunkManifest> manifest(ProjectFile file) {
        var path = file.absPath();
        if (!Files.isRegularFile(path)) {
            throw NotFoundException.file(file.toString());
        }
        if (!FileUtil.isLikelyText(path)) {
            throw new ProtocolException("Not a text file: " + file);
        }
        var current = currentManifest(file);
        if (current != null) {
            return Optional.of(current);
        }

        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            throw NotFoundException.file(file.toString());
        }
        if (size > SYNC_GENERATION_LIMIT_BYTES) {
            generate(file, true);
            return Optional.empty();
        }
        try {
            return Optional.of(generate(file, false).join());
        } catch (CompletionException e) {
            throw unwrap(e);
        }
    }

    /** Reads one chunk, or empty while generation is pending. */
    public Optional<Chunk> read(ProjectFile file, int index) {
        return read(file, index, false);
    }

    private Optional<Chunk> read(ProjectFile file, int index, boolean retried) {
        var manifest = manifest(file);
        if (manifest.isEmpty()) {
            return Optional.empty();
        }
        var m = manifest.get();
        if (index < 0 || index >= m.totalChunks()) {
            throw new NotFoundException("Chunk %d not found for: %s".formatted(index, file));
        }
        var window = ChunkWindows.window(index, m.totalLines(), m.chunkSize(), m.overlap());
        var chunkFile = chunkDirFor(file).resolve(chunkFileName(index));
        try {
            return Optional.of(new Chunk(m.totalChunks(), window, Files.readString(chunkFile, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            // the set was swapped between the manifest check and the read
            logger.debug("Chunk {} of {} vanished during a swap: {}", index, file, e.getMessage());
        }
        if (!retried) {
            return read(file, index, true);
        }
        throw new NotFoundException("Chunk %d not found for: %s".formatted(index, file));
    }

    /** Queues regeneration after a change to a text file. */
    public void onFileChanged(ProjectFile file) {
        var path = file.absPath();
        if (Files.isRegularFile(path) && FileUtil.isLikelyText(path) && currentManifest(file) == null) {
            generate(file, true);
        }
    }

    /** Drops the chunks of a deleted file, or of every file under a deleted directory. */
    public void remove(ProjectFile file) {
        var dir = chunkDirFor(file);
        if (Files.exists(dir) && FileUtil.deleteRecursively(dir)) {
            logger.debug("Removed chunks for {}", file);
        }
    }

    /** Chunks every text file under the root that has no current manifest. */
    public CompletableFuture<Void> scanAll(IgnoreRules ignoreRules) {
        return CompletableFuture.runAsync(
                () -> {
                    long start = System.currentTimeMillis();
                    int[] generated = {0};
                    try {
                        Files.walkFileTree(root, new SimpleFileVisitor<>() {
                            @Override
                            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                                if (!dir.equals(root)) {
                                    var name = dir.getFileName().toString();
                                    if (name.startsWith(".") || ignoreRules.isIgnoredDirectoryName(name)) {
                                        return FileVisitResult.SKIP_SUBTREE;
                                    }
                                }
                                return FileVisitResult.CONTINUE;
                            }

                            @Override
                            public FileVisitResult visitFile(Path path, BasicFileAttributes attrs) {
                                var file = new ProjectFile(root, root.relativize(path));
                                if (attrs.isRegularFile()
                                        && !ignoreRules.isIgnoredFileName(file.getFileName())
                                        && FileUtil.isLikelyText(path)
                                        && currentManifest(file) == null) {
                                    try {
                                        generate(file, false).join();
                                        generated[0]++;
                                    } catch (CompletionException e) {
                                        logger.warn("Failed to chunk {}: {}", file, e.getCause().getMessage());
                                    }
                                }
                                return FileVisitResult.CONTINUE;
                            }

                            @Override
                            public FileVisitResult visitFileFailed(Path path, IOException exc) {
                                return FileVisitResult.CONTINUE;
                            }
                        });
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                    logger.info(
                            "Chunk scan generated {} files in {} ms",
                            generated[0],
                            System.currentTimeMillis() - start);
                },
                executor);
    }

    public boolean isPending(ProjectFile file) {
        return inFlight.containsKey(file);
    }

    Path chunkDirFor(ProjectFile file) {
        return chunksDir.resolve(file.getRelPath());
    }

    static String chunkFileName(int index) {
        return "chunk_%03d.txt".formatted(index);
    }

    private @Nullable ChunkManifest currentManifest(ProjectFile file) {
        var manifestFile = chunkDirFor(file).resolve(MANIFEST);
        if (!Files.isRegularFile(manifestFile)) {
            return null;
        }
        var mtime = FileUtil.mtimeMillis(file.absPath());
        if (mtime.isEmpty()) {
            return null;
        }
        try {
            var manifest = objectMapper.readValue(manifestFile.toFile(), ChunkManifest.class);
            return manifest.isCurrent(mtime.getAsLong(), chunkSize, overlap) ? manifest : null;
        } catch (IOException e) {
            logger.debug("Unreadable manifest {}: {}", manifestFile, e.getMessage());
            return null;
        }
    }

    private CompletableFuture<ChunkManifest> generate(ProjectFile file, boolean async) {
        var future = new CompletableFuture<ChunkManifest>();
        var existing = inFlight.putIfAbsent(file, future);
        if (existing != null) {
            return existing;
        }
        Runnable task = () -> {
            try {
                future.complete(writeChunks(file));
            } catch (Throwable t) {
                future.completeExceptionally(t);
            } finally {
                inFlight.remove(file, future);
            }
        };
        if (async) {
            executor.execute(task);
        } else {
            task.run();
        }
        return future;
    }

    private ChunkManifest writeChunks(ProjectFile file) throws IOException {
        var path = file.absPath();
        long mtime = Files.getLastModifiedTime(path).toMillis();
        var lines = FileUtil.splitLinesKeepEnds(FileUtil.readLenient(path));
        int totalLines = lines.size();
        var windows = ChunkWindows.windows(totalLines, chunkSize, overlap);

        Files.createDirectories(chunksDir);
        var tmpDir = Files.createTempDirectory(chunksDir, ".tmp-");
        try {
            for (var window : windows) {
                var sb = new StringBuilder();
                sb.append("# ").append(file).append(" lines ").append(window.lines()).append('\n');
                for (int i = window.start() - 1; i < window.end(); i++) {
                    sb.append(lines.get(i));
                }
                Files.writeString(tmpDir.resolve(chunkFileName(window.index())), sb, StandardCharsets.UTF_8);
            }
            var manifest =
                    new ChunkManifest(file.toString(), totalLines, chunkSize, overlap, windows.size(), mtime);
            objectMapper.writeValue(tmpDir.resolve(MANIFEST).toFile(), manifest);

            swapInto(tmpDir, chunkDirFor(file));
            logger.debug("Wrote {} chunks for {}", windows.size(), file);
            return manifest;
        } catch (IOException | RuntimeException e) {
            FileUtil.deleteRecursively(tmpDir);
            throw e;
        }
    }

    /**
     * Replaces {@code target} with {@code staged}. The old set is renamed aside rather than deleted first, so
     * the target is absent only between two renames; it is deleted once the new set is in place.
     */
    private void swapInto(Path staged, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Path retired = null;
        if (Files.exists(target)) {
            retired = chunksDir.resolve(".old-" + UUID.randomUUID());
            Files.move(target, retired, StandardCopyOption.ATOMIC_MOVE);
        }
        try {
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (retired != null) {
                Files.move(retired, target, StandardCopyOption.ATOMIC_MOVE);
            }
            throw e;
        }
        if (retired != null) {
            FileUtil.deleteRecursively(retired);
        }
    }

    private static RuntimeException unwrap(CompletionException e) {
        var cause = e.getCause();
        if (cause instanceof NavigatorException ne) {
            return ne;
        }
        if (cause instanceof IOException io) {
            return new UncheckedIOException(io);
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return e;
    }
}
