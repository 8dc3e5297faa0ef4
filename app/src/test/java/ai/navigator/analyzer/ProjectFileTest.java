package ai.navigator.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import ai.navigator.exception.ProtocolException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectFileTest {

    @TempDir
    Path tempDir;

    private Path root;
    private Path outside;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createDirectories(tempDir.resolve("project")).toRealPath();
        outside = Files.createDirectories(tempDir.resolve("outside")).toRealPath();
        Files.writeString(outside.resolve("secret.txt"), "token\n");
        Files.createDirectories(root.resolve("src"));
        Files.writeString(root.resolve("src/main.py"), "x = 1\n");
    }

    @Test
    void testResolvesPathsInsideRoot() {
        assertEquals("src/main.py", ProjectFile.resolve(root, "src/main.py").toString());
        assertEquals("src/main.py", ProjectFile.resolve(root, root.resolve("src/main.py").toString()).toString());
        assertEquals("", ProjectFile.resolve(root, null).toString());
        assertEquals("src/new_dir/file.txt", ProjectFile.resolve(root, "src/new_dir/file.txt").toString());
    }

    @Test
    void testLexicalTraversalIsRejected() {
        assertThrows(ProtocolException.class, () -> ProjectFile.resolve(root, "../outside/secret.txt"));
        assertThrows(ProtocolException.class, () -> ProjectFile.resolve(root, "src/../../outside"));
    }

    @Test
    void testSymlinkPointingOutsideRootIsRejected() throws Exception {
        Files.createSymbolicLink(root.resolve("link"), outside);
        Files.createSymbolicLink(root.resolve("secret_link.txt"), outside.resolve("secret.txt"));

        var e = assertThrows(ProtocolException.class, () -> ProjectFile.resolve(root, "link/secret.txt"));
        assertTrue(e.getMessage().contains("outside project root"), e.getMessage());
        assertThrows(ProtocolException.class, () -> ProjectFile.resolve(root, "secret_link.txt"));
        // not yet created below the link still lands outside
        assertThrows(ProtocolException.class, () -> ProjectFile.resolve(root, "link/new/chunks"));
    }

    @Test
    void testSymlinkWithinRootIsAllowed() throws Exception {
        Files.createSymbolicLink(root.resolve("alias"), root.resolve("src"));

        assertEquals("alias/main.py", ProjectFile.resolve(root, "alias/main.py").toString());
    }
}
