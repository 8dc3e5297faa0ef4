package ai.navigator;

import java.net.BindException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/** Command-line entry point: parses options, starts the daemon and blocks until it stops. */
@CommandLine.Command(
        name = "navigator-daemon",
        mixinStandardHelpOptions = true,
        version = "rlm-navigator-daemon 0.4.0",
        description = "Indexes a project tree and answers navigation queries over loopback TCP.")
public final class NavigatorDaemon implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(NavigatorDaemon.class);

    @CommandLine.Option(
            names = "--root",
            defaultValue = "${env:RLM_ROOT:-.}",
            description = "Project root to index (env RLM_ROOT, default: current directory).")
    private Path root = Path.of(".");

    @CommandLine.Option(
            names = "--port",
            defaultValue = "${env:RLM_PORT:-9177}",
            description = "First port to try; the next 19 are tried if it is taken. 0 picks any free port.")
    private int port = DaemonConfig.DEFAULT_PORT;

    @CommandLine.Option(
            names = "--idle-timeout",
            defaultValue = "${env:RLM_IDLE_TIMEOUT:-300}",
            description = "Seconds without a connection before shutting down; 0 disables.")
    private int idleTimeout = DaemonConfig.DEFAULT_IDLE_TIMEOUT_SECONDS;

    @CommandLine.Option(
            names = "--workers",
            defaultValue = "${env:RLM_WORKERS:-8}",
            description = "Connection worker threads.")
    private int workers = DaemonConfig.DEFAULT_WORKERS;

    @CommandLine.Option(
            names = "--io-timeout-ms",
            defaultValue = "${env:RLM_IO_TIMEOUT_MS:-5000}",
            description = "Socket read timeout per connection.")
    private int ioTimeoutMs = DaemonConfig.DEFAULT_IO_TIMEOUT_MS;

    @CommandLine.Option(
            names = "--debounce-ms",
            defaultValue = "${env:RLM_DEBOUNCE_MS:-500}",
            description = "Quiet period before a burst of file events is applied.")
    private long debounceMs;

    @CommandLine.Option(
            names = "--chunk-size",
            defaultValue = "${env:RLM_CHUNK_SIZE:-200}",
            description = "Lines per chunk.")
    private int chunkSize;

    @CommandLine.Option(
            names = "--chunk-overlap",
            defaultValue = "${env:RLM_CHUNK_OVERLAP:-20}",
            description = "Lines shared by consecutive chunks.")
    private int chunkOverlap;

    @CommandLine.Option(
            names = "--no-chunk-scan",
            defaultValue = "${env:RLM_NO_CHUNK_SCAN:-false}",
            description = "Do not chunk every text file at startup.")
    private boolean noChunkScan;

    @CommandLine.Option(
            names = "--ignore",
            split = ",",
            defaultValue = "${env:RLM_IGNORE}",
            description = "Additional directory name to skip. Can be repeated.")
    private List<String> ignores = new ArrayList<>();

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NavigatorDaemon()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        var absRoot = DaemonConfig.canonicalRoot(root);
        if (!Files.isDirectory(absRoot)) {
            System.err.println("Error: root is not a directory: " + absRoot);
            return 1;
        }
        DaemonConfig config;
        try {
            config = new DaemonConfig(
                    absRoot,
                    port,
                    idleTimeout,
                    workers,
                    ioTimeoutMs,
                    debounceMs,
                    chunkSize,
                    chunkOverlap,
                    !noChunkScan,
                    ignores == null ? List.of() : ignores);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 2;
        }

        Daemon daemon;
        try {
            daemon = Daemon.start(config);
        } catch (BindException e) {
            logger.fatal("Could not bind a port: {}", e.getMessage());
            return 1;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(daemon::stop, "shutdown-hook"));
        daemon.awaitStopped();
        return 0;
    }
}
