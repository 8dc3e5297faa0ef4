package ai.navigator.analyzer;

import ai.navigator.exception.ProtocolException;
import ai.navigator.util.FileUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Abstraction for a filename relative to the project root. This exists to make it less difficult to ensure
 * that different filename objects can be meaningfully compared, unlike bare Paths which may or may not be
 * absolute, or may be relative to the jvm root rather than the project root.
 */
public final class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    /** root must be pre-normalized; we will normalize relPath if it is not already */
    public ProjectFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        var normalized = relPath.normalize();
        if (normalized.startsWith("..")) {
            throw new IllegalArgumentException("RelPath escapes root: " + relPath);
        }
        this.root = root;
        this.relPath = normalized;
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    /**
     * Resolves a client-supplied path (relative to root, or absolute inside root) and rejects anything that
     * escapes the root.
     */
    public static ProjectFile resolve(Path root, @Nullable String clientPath) {
        var raw = clientPath == null ? "" : clientPath.strip();
        Path candidate;
        try {
            candidate = raw.isEmpty() ? root : root.resolve(raw).normalize();
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid path: " + raw, e);
        }
        if (!candidate.startsWith(root) || escapesThroughLink(root, candidate)) {
            throw new ProtocolException("Path outside project root: " + raw);
        }
        return new ProjectFile(root, root.relativize(candidate));
    }

    /**
     * True when the deepest existing part of {@code candidate} resolves, through a symlink, to a location
     * outside the real root.
     */
    private static boolean escapesThroughLink(Path root, Path candidate) {
        Path realRoot;
        try {
            realRoot = root.toRealPath();
        } catch (IOException e) {
            return false;
        }
        for (Path p = candidate; p != null && p.startsWith(root); p = p.getParent()) {
            if (Files.exists(p, LinkOption.NOFOLLOW_LINKS)) {
                try {
                    return !p.toRealPath().startsWith(realRoot);
                } catch (IOException e) {
                    // dangling link
                    return true;
                }
            }
        }
        return false;
    }

    public Path getRoot() {
        return root;
    }

    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    public String getFileName() {
        var name = relPath.getFileName();
        return name == null ? "" : name.toString();
    }

    /** Lower-cased extension including the dot, or empty. */
    public String extension() {
        var name = getFileName();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /** True when this file is {@code dir} itself or lies beneath it. */
    public boolean isUnder(ProjectFile dir) {
        return dir.relPath.toString().isEmpty() || relPath.startsWith(dir.relPath);
    }

    @Override
    public String toString() {
        return FileUtil.toSlashPath(relPath);
    }

    @Override
    public int compareTo(ProjectFile o) {
        return toString().compareTo(o.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
