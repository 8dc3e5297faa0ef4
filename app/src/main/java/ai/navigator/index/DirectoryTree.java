package ai.navigator.index;

import ai.navigator.analyzer.Languages;
import ai.navigator.analyzer.ProjectFile;
import ai.navigator.exception.NotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/** Nested directory listing, directories first, names compared case-insensitively. */
public final class DirectoryTree {
    public static final int DEFAULT_MAX_DEPTH = 4;

    private static final Comparator<Path> ORDER = Comparator.<Path, Boolean>comparing(p -> !Files.isDirectory(p))
            .thenComparing(p -> p.getFileName().toString().toLowerCase(Locale.ROOT))
            .thenComparing(p -> p.getFileName().toString());

    private final IgnoreRules ignoreRules;

    public DirectoryTree(IgnoreRules ignoreRules) {
        this.ignoreRules = ignoreRules;
    }

    /**
     * Lists {@code dir}. Entries of the top level are at depth 1; a directory's {@code entries} are only
     * included while its depth is below {@code maxDepth}, its {@code children} count always is.
     */
    public List<Map<String, Object>> list(ProjectFile dir, int maxDepth) {
        var path = dir.absPath();
        if (Files.isRegularFile(path)) {
            return List.of(fileEntry(dir, path));
        }
        if (!Files.isDirectory(path)) {
            throw NotFoundException.file(dir.toString());
        }
        return entries(dir.getRoot(), path, 1, Math.max(1, maxDepth));
    }

    private List<Map<String, Object>> entries(Path root, Path dir, int depth, int maxDepth) {
        var result = new ArrayList<Map<String, Object>>();
        for (Path child : visibleChildren(dir)) {
            var pf = new ProjectFile(root, root.relativize(child));
            if (Files.isDirectory(child)) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("type", "directory");
                entry.put("name", pf.getFileName());
                entry.put("path", pf.toString());
                var grandChildren = visibleChildren(child);
                entry.put("children", grandChildren.size());
                if (depth < maxDepth) {
                    entry.put("entries", entries(root, child, depth + 1, maxDepth));
                }
                result.add(entry);
            } else {
                result.add(fileEntry(pf, child));
            }
        }
        return result;
    }

    private Map<String, Object> fileEntry(ProjectFile pf, Path path) {
        var entry = new LinkedHashMap<String, Object>();
        entry.put("type", "file");
        entry.put("name", pf.getFileName());
        entry.put("path", pf.toString());
        try {
            entry.put("size", Files.size(path));
        } catch (IOException e) {
            entry.put("size", 0L);
        }
        var language = Languages.detect(pf);
        if (language != null) {
            entry.put("language", language);
        }
        return entry;
    }

    private List<Path> visibleChildren(Path dir) {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(this::isVisible).sorted(ORDER).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    private boolean isVisible(Path child) {
        var name = child.getFileName().toString();
        if (name.startsWith(".")) {
            return false;
        }
        if (Files.isDirectory(child)) {
            return !ignoreRules.isIgnoredDirectoryName(name);
        }
        return Files.isRegularFile(child) && !ignoreRules.isIgnoredFileName(name);
    }
}
