package ai.navigator.index;

import static org.junit.jupiter.api.Assertions.*;

import ai.navigator.analyzer.ProjectFile;
import ai.navigator.exception.NotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryTreeTest {

    @TempDir
    Path root;

    private final DirectoryTree tree = new DirectoryTree(IgnoreRules.defaults());

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(root.resolve("src/pkg"));
        Files.createDirectories(root.resolve(".git"));
        Files.createDirectories(root.resolve("node_modules/x"));
        Files.writeString(root.resolve("src/pkg/mod.py"), "x = 1\n");
        Files.writeString(root.resolve("src/Main.java"), "class Main {}\n");
        Files.writeString(root.resolve("README.md"), "hello");
        Files.writeString(root.resolve("b.txt"), "b");
        Files.writeString(root.resolve(".hidden"), "h");
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> entries(Map<String, Object> dir) {
        return (List<Map<String, Object>>) dir.get("entries");
    }

    @Test
    void testDirectoriesFirstAndIgnoredEntriesSkipped() {
        var listing = tree.list(ProjectFile.resolve(root, null), DirectoryTree.DEFAULT_MAX_DEPTH);

        var names = listing.stream().map(e -> e.get("name")).toList();
        assertEquals(List.of("src", "b.txt", "README.md"), names);

        var src = listing.get(0);
        assertEquals("directory", src.get("type"));
        assertEquals("src", src.get("path"));
        assertEquals(2, src.get("children"));

        var srcEntries = entries(src);
        assertEquals("pkg", srcEntries.get(0).get("name"));
        var main = srcEntries.get(1);
        assertEquals("file", main.get("type"));
        assertEquals("src/Main.java", main.get("path"));
        assertEquals("java", main.get("language"));
        assertEquals(14L, main.get("size"));

        var readme = listing.get(2);
        assertEquals(5L, readme.get("size"));
        assertFalse(readme.containsKey("language"));
    }

    @Test
    void testMaxDepthStopsExpansion() {
        var listing = tree.list(ProjectFile.resolve(root, null), 1);

        var src = listing.get(0);
        assertEquals(2, src.get("children"));
        assertFalse(src.containsKey("entries"));
    }

    @Test
    void testSubdirectoryAndMissingPath() {
        var listing = tree.list(ProjectFile.resolve(root, "src/pkg"), 4);
        assertEquals("src/pkg/mod.py", listing.get(0).get("path"));

        assertThrows(NotFoundException.class, () -> tree.list(ProjectFile.resolve(root, "nope"), 4));
    }
}
