package ai.navigator.watch;

import ai.navigator.analyzer.Languages;
import ai.navigator.analyzer.ProjectFile;
import ai.navigator.chunk.ChunkStore;
import ai.navigator.index.IgnoreRules;
import ai.navigator.index.SkeletonCache;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Applies debounced file system events to the skeleton cache and the chunk store. Runs on the watcher
 * thread; extraction happens synchronously so a batch is fully applied before the next one is read.
 */
public final class CacheInvalidationListener implements IWatchService.Listener {
    private static final Logger logger = LogManager.getLogger(CacheInvalidationListener.class);

    private final SkeletonCache cache;
    private final @Nullable ChunkStore chunkStore;
    private final IgnoreRules ignoreRules;
    private final Runnable onRootLost;

    public CacheInvalidationListener(
            SkeletonCache cache, @Nullable ChunkStore chunkStore, IgnoreRules ignoreRules, Runnable onRootLost) {
        this.cache = cache;
        this.chunkStore = chunkStore;
        this.ignoreRules = ignoreRules;
        this.onRootLost = onRootLost;
    }

    @Override
    public void onFilesChanged(IWatchService.EventBatch batch) {
        if (batch.isOverflowed()) {
            logger.info("Watch event overflow; clearing {} cached records", cache.size());
            cache.clear();
        }
        for (ProjectFile file : batch.files()) {
            if (ignoreRules.isIgnored(file.getRelPath())) {
                continue;
            }
            var path = file.absPath();
            if (Files.isRegularFile(path)) {
                fileChanged(file);
            } else if (Files.isDirectory(path)) {
                directoryCreated(file);
            } else {
                deleted(file);
            }
        }
    }

    @Override
    public void onRootLost() {
        cache.clear();
        onRootLost.run();
    }

    private void fileChanged(ProjectFile file) {
        // unsupported files only stay fresh if someone already asked for them
        if (cache.extractor().supports(Languages.detect(file)) || cache.isCached(file)) {
            try {
                cache.refresh(file);
                logger.debug("Refreshed {}", file);
            } catch (UncheckedIOException e) {
                logger.warn("Could not refresh {}: {}", file, e.getMessage());
                cache.remove(file);
            }
        }
        if (chunkStore != null) {
            chunkStore.onFileChanged(file);
        }
    }

    private void directoryCreated(ProjectFile dir) {
        // files moved in together with their directory produce no events of their own
        try (Stream<Path> stream = Files.walk(dir.absPath())) {
            stream.filter(Files::isRegularFile)
                    .map(p -> new ProjectFile(dir.getRoot(), dir.getRoot().relativize(p)))
                    .filter(f -> !ignoreRules.isIgnored(f.getRelPath()))
                    .forEach(this::fileChanged);
        } catch (IOException | UncheckedIOException e) {
            logger.debug("Could not scan new directory {}: {}", dir, e.getMessage());
        }
    }

    private void deleted(ProjectFile file) {
        cache.remove(file);
        // a deleted directory takes its files with it
        cache.cachedFiles().stream().filter(f -> f.isUnder(file)).forEach(cache::remove);
        if (chunkStore != null) {
            chunkStore.remove(file);
        }
        logger.debug("Removed {}", file);
    }
}
