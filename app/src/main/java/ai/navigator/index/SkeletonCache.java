package ai.navigator.index;

import ai.navigator.analyzer.Languages;
import ai.navigator.analyzer.ProjectFile;
import ai.navigator.analyzer.SkeletonExtractor;
import ai.navigator.exception.NotFoundException;
import ai.navigator.util.FileUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Path to {@link FileRecord} store. Records are computed lazily on first access and eagerly by the
 * watcher. Extraction runs on the calling thread outside of any store-wide lock; concurrent
 * computations for the same path are reconciled by generation number so an older result never
 * replaces a newer one.
 */
public final class SkeletonCache {
    private static final Logger logger = LogManager.getLogger(SkeletonCache.class);

    private final SkeletonExtractor extractor;
    private final ConcurrentHashMap<ProjectFile, FileRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    public SkeletonCache(SkeletonExtractor extractor) {
        this.extractor = extractor;
    }

    public SkeletonExtractor extractor() {
        return extractor;
    }

    /**
     * Returns the current record for a file, recomputing it when missing or when the file's mtime no
     * longer matches.
     *
     * @throws NotFoundException if the file does not exist
     */
    public FileRecord get(ProjectFile file) {
        var path = file.absPath();
        if (!Files.isRegularFile(path)) {
            records.remove(file);
            throw NotFoundException.file(file.toString());
        }
        var existing = records.get(file);
        var mtime = FileUtil.mtimeMillis(path);
        if (existing != null && mtime.isPresent() && existing.mtime() == mtime.getAsLong()) {
            return existing;
        }
        return refresh(file).orElseThrow(() -> NotFoundException.file(file.toString()));
    }

    /**
     * Re-reads and re-extracts a file. Returns empty (and drops any record) if the file vanished.
     */
    public Optional<FileRecord> refresh(ProjectFile file) {
        long generation = generations.incrementAndGet();
        var path = file.absPath();
        byte[] content;
        long mtime;
        try {
            mtime = Files.getLastModifiedTime(path).toMillis();
            content = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            remove(file);
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }

        var language = Languages.detect(file);
        var skeleton = extractor.extract(file.getFileName(), content, language);
        var record = new FileRecord(
                file.toString(),
                sha256(content),
                mtime,
                content.length,
                skeleton.language(),
                skeleton.text(),
                skeleton.symbols(),
                skeleton.totalLines(),
                generation);

        var winner = records.merge(
                file, record, (old, fresh) -> fresh.generation() > old.generation() ? fresh : old);
        if (winner != record) {
            logger.debug("Discarded stale extraction of {} (generation {})", file, generation);
        }
        return Optional.of(winner);
    }

    public void remove(ProjectFile file) {
        if (records.remove(file) != null) {
            logger.debug("Evicted {}", file);
        }
    }

    public void clear() {
        records.clear();
    }

    public boolean isCached(ProjectFile file) {
        return records.containsKey(file);
    }

    public Set<ProjectFile> cachedFiles() {
        return Set.copyOf(records.keySet());
    }

    public int size() {
        return records.size();
    }

    static String sha256(byte[] content) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            var hash = digest.digest(content);
            var sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }
}
