package ai.navigator;

import ai.navigator.chunk.ChunkWindows;
import ai.navigator.watch.ProjectWatchService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Immutable daemon settings, collected from the command line and environment.
 *
 * @param root project root with symlinks resolved when it exists, otherwise absolute and normalized
 * @param port first port to try; 0 asks the OS for an ephemeral port
 * @param idleTimeoutSeconds shut down after this long without a connection; 0 disables
 * @param ioTimeoutMs per-connection socket read timeout
 * @param chunkScan whether to chunk every text file in the background at startup
 * @param extraIgnores directory names skipped in addition to the built-in list
 */
public record DaemonConfig(
        Path root,
        int port,
        int idleTimeoutSeconds,
        int workers,
        int ioTimeoutMs,
        long debounceMs,
        int chunkSize,
        int chunkOverlap,
        boolean chunkScan,
        List<String> extraIgnores) {

    public static final int DEFAULT_PORT = 9177;
    public static final int PORT_ATTEMPTS = 20;
    public static final int DEFAULT_IDLE_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_WORKERS = 8;
    public static final int DEFAULT_IO_TIMEOUT_MS = 5000;

    public DaemonConfig {
        root = canonicalRoot(root);
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (idleTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Idle timeout must not be negative: " + idleTimeoutSeconds);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("Need at least one worker, got " + workers);
        }
        if (ioTimeoutMs < 1) {
            throw new IllegalArgumentException("I/O timeout must be positive: " + ioTimeoutMs);
        }
        ChunkWindows.validate(chunkSize, chunkOverlap);
        extraIgnores = List.copyOf(extraIgnores);
    }

    static Path canonicalRoot(Path root) {
        try {
            return root.toRealPath();
        } catch (IOException e) {
            // a missing root is reported by the caller
            return root.toAbsolutePath().normalize();
        }
    }

    /** Defaults for everything but the root, with an ephemeral port. */
    public static DaemonConfig forRoot(Path root) {
        return new DaemonConfig(
                root,
                0,
                0,
                DEFAULT_WORKERS,
                DEFAULT_IO_TIMEOUT_MS,
                ProjectWatchService.DEFAULT_DEBOUNCE_MS,
                ChunkWindows.DEFAULT_SIZE,
                ChunkWindows.DEFAULT_OVERLAP,
                false,
                List.of());
    }

    public Path rlmDir() {
        return root.resolve(".rlm");
    }
}
