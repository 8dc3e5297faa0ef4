package ai.navigator.watch;

import ai.navigator.analyzer.ProjectFile;
import ai.navigator.index.IgnoreRules;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class ProjectWatchService implements IWatchService {

    private final Logger logger = LogManager.getLogger(ProjectWatchService.class);

    public static final long DEFAULT_DEBOUNCE_MS = 500;
    private static final long POLL_TIMEOUT_MS = 250;
    /** A batch is flushed after at most this many debounce periods, even while events keep arriving. */
    static final int MAX_DEBOUNCE_PERIODS = 4;

    private final Path root;
    private final IgnoreRules ignoreRules;
    private final long debounceMs;
    private final List<Listener> listeners;
    private final CompletableFuture<Void> registered = new CompletableFuture<>();

    private volatile boolean running = true;

    /**
     * Create a ProjectWatchService with multiple listeners.
     * All registered listeners will be notified of file system events.
     */
    public ProjectWatchService(Path root, IgnoreRules ignoreRules, long debounceMs, List<Listener> listeners) {
        this.root = root;
        this.ignoreRules = ignoreRules;
        this.debounceMs = debounceMs;
        this.listeners = new CopyOnWriteArrayList<>(listeners);
    }

    @Override
    public void start(CompletableFuture<?> delayNotificationsUntilCompleted) {
        Thread watcherThread = new Thread(
                () -> beginWatching(delayNotificationsUntilCompleted),
                "DirectoryWatcher@" + Long.toHexString(Thread.currentThread().getId()));
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    /** Completes once every directory under the root has been registered. */
    public CompletableFuture<Void> registered() {
        return registered;
    }

    private void beginWatching(CompletableFuture<?> delayNotificationsUntilCompleted) {
        logger.debug("Setting up WatchService for {}", root);
        try (WatchService watchService = FileSystems.getDefault().newWatchService()) {
            // Recursively register all directories under project root except ignored ones
            registerAllDirectories(root, watchService);
            registered.complete(null);

            // Wait for the initial future to complete.
            // The WatchService will queue any events that arrive during this time.
            try {
                delayNotificationsUntilCompleted.get();
            } catch (InterruptedException | ExecutionException e) {
                logger.debug("Error while waiting for the initial Future to complete", e);
                throw new RuntimeException(e);
            }

            // Watch for events, debounce them, and handle them
            while (running) {
                WatchKey key = watchService.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);

                // No event arrived within the poll window
                if (key == null) {
                    if (!Files.isDirectory(root)) {
                        rootLost();
                        break;
                    }
                    notifyNoFilesChanged();
                    continue;
                }

                // We got an event, collect it and any others within the debounce window
                var batch = new EventBatch();
                boolean rootValid = collectEventsFromKey(key, watchService, batch);

                long batchStart = System.currentTimeMillis();
                long hardDeadline = batchStart + debounceMs * MAX_DEBOUNCE_PERIODS;
                long deadline = nextDeadline(batchStart, debounceMs, hardDeadline);
                while (rootValid) {
                    long remaining = deadline - System.currentTimeMillis();
                    if (remaining <= 0) break;
                    WatchKey nextKey = watchService.poll(remaining, TimeUnit.MILLISECONDS);
                    if (nextKey == null) break;
                    // every new key restarts the quiet period, up to the hard deadline
                    deadline = nextDeadline(System.currentTimeMillis(), debounceMs, hardDeadline);
                    rootValid = collectEventsFromKey(nextKey, watchService, batch);
                }

                // Process the batch
                if (batch.isOverflowed || !batch.files.isEmpty()) {
                    notifyFilesChanged(batch);
                }
                if (!rootValid) {
                    rootLost();
                    break;
                }
            }
        } catch (IOException e) {
            registered.completeExceptionally(e);
            logger.error("Error setting up watch service", e);
        } catch (ClosedWatchServiceException e) {
            logger.debug("Watch service closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("FileWatchService thread interrupted; shutting down");
        }
    }

    static long nextDeadline(long now, long debounceMs, long hardDeadline) {
        return Math.min(now + debounceMs, hardDeadline);
    }

    /** @return false when the root directory's own key was invalidated */
    private boolean collectEventsFromKey(WatchKey key, WatchService watchService, EventBatch batch) {
        Path watchPath = (Path) key.watchable();
        for (WatchEvent<?> event : key.pollEvents()) {
            if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                batch.isOverflowed = true;
                continue;
            }

            // Guard: context might be null (OVERFLOW) or not a Path
            if (!(event.context() instanceof Path ctx)) {
                logger.warn("Event is not overflow but has no path: {}", event);
                continue;
            }

            Path eventPath = watchPath.resolve(ctx);
            Path relativized;
            try {
                relativized = root.relativize(eventPath);
            } catch (IllegalArgumentException e) {
                throw new RuntimeException("Failed to relativize path: %s to %s".formatted(eventPath, root), e);
            }
            if (ignoreRules.isIgnored(relativized)) {
                continue;
            }
            batch.files.add(new ProjectFile(root, relativized));

            // If it's a directory creation, register it so we can watch its children
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(eventPath)) {
                try {
                    registerAllDirectories(eventPath, watchService);
                } catch (IOException ex) {
                    logger.warn("Failed to register new directory for watching: {}", eventPath, ex);
                }
            }
        }

        // If the key is no longer valid, we can't watch this path anymore
        if (!key.reset()) {
            logger.debug("Watch key no longer valid: {}", key.watchable());
            return !watchPath.equals(root);
        }
        return true;
    }

    /**
     * @param start can be either the root project directory, or a newly created directory we want to add to the watch
     */
    private void registerAllDirectories(Path start, WatchService watchService) throws IOException {
        if (!Files.isDirectory(start)) return;

        for (int attempt = 1; attempt <= 3; attempt++) {
            try (var walker = Files.walk(start)) {
                walker.filter(Files::isDirectory)
                        .filter(dir -> dir.equals(root) || !ignoreRules.isIgnored(root.relativize(dir)))
                        .forEach(dir -> {
                            try {
                                dir.register(
                                        watchService,
                                        StandardWatchEventKinds.ENTRY_CREATE,
                                        StandardWatchEventKinds.ENTRY_DELETE,
                                        StandardWatchEventKinds.ENTRY_MODIFY);
                            } catch (IOException e) {
                                logger.warn("Failed to register directory for watching: {}", dir, e);
                            }
                        });
                // Success: If the walk completes without exception, break the retry loop.
                return;
            } catch (IOException | UncheckedIOException e) {
                // Determine the root cause, handling the case where the UncheckedIOException wraps another exception.
                Throwable cause = (e instanceof UncheckedIOException uioe) ? uioe.getCause() : e;

                // Retry only if it's a NoSuchFileException and we have attempts left.
                if (cause instanceof NoSuchFileException && attempt < 3) {
                    logger.warn(
                            "Attempt {} failed to walk directory {} due to NoSuchFileException. Retrying in 10ms...",
                            attempt,
                            start,
                            cause);
                    try {
                        Thread.sleep(10);
                    } catch (InterruptedException ie) {
                        throw new RuntimeException(e);
                    }
                }
            }
        } // End of retry loop
        logger.debug("Failed to (completely) register directory `{}` for watching", start);
    }

    @Override
    public void addListener(Listener listener) {
        listeners.add(listener);
        logger.debug("Added listener: {}", listener.getClass().getSimpleName());
    }

    @Override
    public void removeListener(Listener listener) {
        listeners.remove(listener);
        logger.debug("Removed listener: {}", listener.getClass().getSimpleName());
    }

    @Override
    public synchronized void close() {
        running = false;
    }

    private void rootLost() {
        logger.fatal("Watched root {} is gone; file watching stopped", root);
        running = false;
        for (Listener listener : listeners) {
            try {
                listener.onRootLost();
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of root loss",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }

    /**
     * Notify all registered listeners that files have changed.
     */
    private void notifyFilesChanged(EventBatch batch) {
        for (Listener listener : listeners) {
            try {
                listener.onFilesChanged(batch);
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }

    /**
     * Notify all registered listeners that no files changed during the poll interval.
     */
    private void notifyNoFilesChanged() {
        for (Listener listener : listeners) {
            try {
                listener.onNoFilesChangedDuringPollInterval();
            } catch (Exception e) {
                logger.error(
                        "Error notifying listener {} of no file changes",
                        listener.getClass().getSimpleName(),
                        e);
            }
        }
    }
}
