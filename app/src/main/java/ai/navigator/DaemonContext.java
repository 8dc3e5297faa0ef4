package ai.navigator;

import ai.navigator.analyzer.SkeletonExtractor;
import ai.navigator.chunk.ChunkStore;
import ai.navigator.index.DirectoryTree;
import ai.navigator.index.IgnoreRules;
import ai.navigator.index.SkeletonCache;
import ai.navigator.index.SymbolSearch;
import ai.navigator.repl.ReplEngine;
import ai.navigator.stats.SessionStats;
import ai.navigator.util.ExecutorServiceUtil;
import ai.navigator.watch.CacheInvalidationListener;
import ai.navigator.watch.IWatchService;
import ai.navigator.watch.ProjectWatchService;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Everything a running daemon shares between request handlers: configuration, the skeleton cache, the
 * chunk store, the REPL and the session statistics. Each component is internally synchronized.
 */
public final class DaemonContext implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(DaemonContext.class);

    private static final int CHUNK_THREADS = 2;

    private final DaemonConfig config;
    private final IgnoreRules ignoreRules;
    private final SkeletonCache cache;
    private final SymbolSearch search;
    private final DirectoryTree tree;
    private final ExecutorService chunkExecutor;
    private final ChunkStore chunkStore;
    private final ReplEngine repl;
    private final SessionStats stats = new SessionStats();
    private final AtomicBoolean rootLost = new AtomicBoolean(false);
    private final AtomicLong lastActivity = new AtomicLong(System.currentTimeMillis());
    private @Nullable IWatchService watcher;

    public DaemonContext(DaemonConfig config) {
        this.config = config;
        this.ignoreRules = new IgnoreRules(config.extraIgnores());
        this.cache = new SkeletonCache(SkeletonExtractor.withDefaultLanguages());
        this.search = new SymbolSearch(cache, ignoreRules);
        this.tree = new DirectoryTree(ignoreRules);
        this.chunkExecutor = ExecutorServiceUtil.newFixedThreadExecutor(CHUNK_THREADS, "chunker");
        this.chunkStore = new ChunkStore(
                config.root(),
                config.rlmDir().resolve("chunks"),
                config.chunkSize(),
                config.chunkOverlap(),
                chunkExecutor);
        this.repl = new ReplEngine(config.root(), ignoreRules);
    }

    /**
     * Starts watching the root. The returned future completes once every directory is registered, so
     * changes made after it completes are guaranteed to be seen.
     */
    public synchronized CompletableFuture<Void> startWatcher() {
        var listener = new CacheInvalidationListener(cache, chunkStore, ignoreRules, this::markRootLost);
        var service = new ProjectWatchService(config.root(), ignoreRules, config.debounceMs(), List.of(listener));
        service.start(CompletableFuture.completedFuture(null));
        watcher = service;
        if (config.chunkScan()) {
            chunkStore.scanAll(ignoreRules);
        }
        return service.registered();
    }

    public void markRootLost() {
        if (rootLost.compareAndSet(false, true)) {
            logger.fatal("Project root {} is gone; only status requests will be answered", config.root());
        }
    }

    public boolean isRootLost() {
        return rootLost.get();
    }

    /** Records client activity for the idle watchdog. */
    public void touch() {
        lastActivity.set(System.currentTimeMillis());
    }

    public long lastActivity() {
        return lastActivity.get();
    }

    public DaemonConfig config() {
        return config;
    }

    public Path root() {
        return config.root();
    }

    public IgnoreRules ignoreRules() {
        return ignoreRules;
    }

    public SkeletonCache cache() {
        return cache;
    }

    public SymbolSearch search() {
        return search;
    }

    public DirectoryTree tree() {
        return tree;
    }

    public ChunkStore chunkStore() {
        return chunkStore;
    }

    public ReplEngine repl() {
        return repl;
    }

    public SessionStats stats() {
        return stats;
    }

    @Override
    public synchronized void close() {
        if (watcher != null) {
            watcher.close();
            watcher = null;
        }
        repl.close();
        chunkExecutor.shutdown();
        try {
            if (!chunkExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                chunkExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            chunkExecutor.shutdownNow();
        }
    }
}
