package ai.navigator.index;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Directory names and file patterns that are never indexed, watched or listed. */
public final class IgnoreRules {
    public static final Set<String> DEFAULT_DIRECTORIES = Set.of(
            ".git", ".hg", ".svn", "node_modules", "__pycache__", ".venv", "venv", ".env", "dist", "build",
            ".next", ".nuxt", "target", ".idea", ".vscode", ".rlm", ".claude");

    private static final List<String> IGNORED_SUFFIXES =
            List.of(".pyc", ".pyo", ".class", ".o", ".so", ".dll", ".swp", ".tmp", "~");

    private final Set<String> directories;

    public IgnoreRules(Collection<String> extraDirectories) {
        this.directories = Stream.concat(DEFAULT_DIRECTORIES.stream(), extraDirectories.stream())
                .collect(Collectors.toUnmodifiableSet());
    }

    public static IgnoreRules defaults() {
        return new IgnoreRules(List.of());
    }

    public Set<String> directories() {
        return directories;
    }

    public boolean isIgnoredDirectoryName(String name) {
        return directories.contains(name);
    }

    public boolean isIgnoredFileName(String name) {
        if (name.startsWith(".")) {
            return true;
        }
        for (String suffix : IGNORED_SUFFIXES) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    /** True when any directory component of the relative path is ignored, or the file name is. */
    public boolean isIgnored(Path relPath) {
        int count = relPath.getNameCount();
        for (int i = 0; i < count - 1; i++) {
            if (isIgnoredDirectoryName(relPath.getName(i).toString())) {
                return true;
            }
        }
        if (count == 0) {
            return false;
        }
        String last = relPath.getName(count - 1).toString();
        return !last.isEmpty() && (isIgnoredDirectoryName(last) || isIgnoredFileName(last));
    }
}
