package ai.navigator.index;

import ai.navigator.analyzer.Languages;
import ai.navigator.analyzer.ProjectFile;
import ai.navigator.exception.NotFoundException;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Case-insensitive search over the skeletons of every supported file in a subtree. */
public final class SymbolSearch {
    private static final Logger logger = LogManager.getLogger(SymbolSearch.class);
    private static final Splitter LINES = Splitter.on('\n');

    public static final int DEFAULT_MAX_FILES = 50;
    public static final int DEFAULT_MAX_MATCHES_PER_FILE = 10;

    private final SkeletonCache cache;
    private final IgnoreRules ignoreRules;
    private final int maxFiles;
    private final int maxMatchesPerFile;

    public SymbolSearch(SkeletonCache cache, IgnoreRules ignoreRules) {
        this(cache, ignoreRules, DEFAULT_MAX_FILES, DEFAULT_MAX_MATCHES_PER_FILE);
    }

    public SymbolSearch(SkeletonCache cache, IgnoreRules ignoreRules, int maxFiles, int maxMatchesPerFile) {
        this.cache = cache;
        this.ignoreRules = ignoreRules;
        this.maxFiles = maxFiles;
        this.maxMatchesPerFile = maxMatchesPerFile;
    }

    public record Hit(String path, List<String> matches) {}

    /**
     * @param hits matching files in path order
     * @param matchedBytes combined size of the matching files
     */
    public record Result(List<Hit> hits, long matchedBytes) {}

    public Result search(String query, ProjectFile subtree) {
        var needle = query.toLowerCase(Locale.ROOT);
        var hits = new ArrayList<Hit>();
        long matchedBytes = 0;
        if (needle.isEmpty()) {
            return new Result(hits, 0);
        }
        for (ProjectFile file : supportedFiles(subtree)) {
            if (hits.size() >= maxFiles) {
                break;
            }
            FileRecord record;
            try {
                record = cache.get(file);
            } catch (NotFoundException e) {
                // deleted between listing and reading
                continue;
            }
            var matches = matchingLines(record, needle);
            if (!matches.isEmpty()) {
                hits.add(new Hit(record.path(), matches));
                matchedBytes += record.size();
            }
        }
        return new Result(List.copyOf(hits), matchedBytes);
    }

    private List<String> matchingLines(FileRecord record, String needle) {
        var matches = new ArrayList<String>();
        boolean header = true;
        for (String line : LINES.split(record.skeleton())) {
            if (header) {
                header = false;
                continue;
            }
            var stripped = line.strip();
            if (stripped.isEmpty() || stripped.equals("...")) {
                continue;
            }
            if (stripped.toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(stripped);
                if (matches.size() >= maxMatchesPerFile) {
                    break;
                }
            }
        }
        return matches;
    }

    /** Supported, non-ignored files under {@code subtree}, sorted by relative path. */
    List<ProjectFile> supportedFiles(ProjectFile subtree) {
        var start = subtree.absPath();
        var root = subtree.getRoot();
        if (Files.isRegularFile(start)) {
            return isSupported(subtree) ? List.of(subtree) : List.of();
        }
        if (!Files.isDirectory(start)) {
            throw NotFoundException.file(subtree.toString());
        }

        var files = new ArrayList<ProjectFile>();
        try {
            Files.walkFileTree(start, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(start) && ignoreRules.isIgnoredDirectoryName(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        var pf = new ProjectFile(root, root.relativize(file));
                        if (!ignoreRules.isIgnored(pf.getRelPath()) && isSupported(pf)) {
                            files.add(pf);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    logger.debug("Skipping unreadable {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk " + subtree, e);
        }
        files.sort(null);
        return files;
    }

    private boolean isSupported(ProjectFile file) {
        return cache.extractor().supports(Languages.detect(file));
    }
}
