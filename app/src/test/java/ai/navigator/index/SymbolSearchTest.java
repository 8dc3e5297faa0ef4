package ai.navigator.index;

import static org.junit.jupiter.api.Assertions.*;

import ai.navigator.analyzer.ProjectFile;
import ai.navigator.analyzer.SkeletonExtractor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SymbolSearchTest {

    @TempDir
    Path root;

    private SymbolSearch search;

    @BeforeEach
    void setUp() throws Exception {
        var cache = new SkeletonCache(SkeletonExtractor.withDefaultLanguages());
        search = new SymbolSearch(cache, IgnoreRules.defaults());
        write("a/util.py", "def foo(x):\n    return x + 1\n");
        write("a/deep/more.py", "def food():\n    pass\n\ndef other():\n    pass\n");
        write("b/elsewhere.py", "def foo():\n    pass\n");
        write("a/notes.txt", "foo foo foo\n");
        write("node_modules/lib/foo.js", "function foo() {}\n");
    }

    private void write(String rel, String content) throws Exception {
        var path = root.resolve(rel);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
    }

    @Test
    void testSearchIsRestrictedToSubtree() {
        var result = search.search("foo", ProjectFile.resolve(root, "a/"));

        var paths = result.hits().stream().map(SymbolSearch.Hit::path).toList();
        assertEquals(List.of("a/deep/more.py", "a/util.py"), paths);
        assertTrue(result.hits().get(1).matches().get(0).startsWith("def foo(x):"));
        assertTrue(result.matchedBytes() > 0);
    }

    @Test
    void testSearchWholeTreeSkipsIgnoredDirectories() {
        var result = search.search("FOO", ProjectFile.resolve(root, null));

        var paths = result.hits().stream().map(SymbolSearch.Hit::path).toList();
        assertEquals(List.of("a/deep/more.py", "a/util.py", "b/elsewhere.py"), paths);
    }

    @Test
    void testMatchesExcludeHeaderAndElidedBodies() {
        var result = search.search("more", ProjectFile.resolve(root, null));

        assertTrue(result.hits().isEmpty(), "File name in the header line must not match: " + result.hits());
    }

    @Test
    void testLimits() {
        var limited = new SymbolSearch(
                new SkeletonCache(SkeletonExtractor.withDefaultLanguages()), IgnoreRules.defaults(), 1, 1);

        var result = limited.search("o", ProjectFile.resolve(root, null));

        assertEquals(1, result.hits().size());
        assertEquals(1, result.hits().get(0).matches().size());
    }
}
