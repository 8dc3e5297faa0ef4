package ai.navigator;

import static org.junit.jupiter.api.Assertions.*;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class NavigatorDaemonTest {

    @TempDir
    Path tempDir;

    @Test
    void testHelp() {
        var out = new StringWriter();
        var cmd = new CommandLine(new NavigatorDaemon());
        cmd.setOut(new PrintWriter(out));

        assertEquals(0, cmd.execute("--help"));
        assertTrue(out.toString().contains("--idle-timeout"));
        assertTrue(out.toString().contains("--chunk-overlap"));
    }

    @Test
    void testRootMustBeDirectory() throws Exception {
        Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

        assertEquals(1, new CommandLine(new NavigatorDaemon()).execute("--root", file.toString()));
        assertEquals(1, new CommandLine(new NavigatorDaemon()).execute("--root", tempDir.resolve("missing").toString()));
    }

    @Test
    void testInvalidChunkSettingsAreRejected() {
        int exit = new CommandLine(new NavigatorDaemon())
                .execute("--root", tempDir.toString(), "--chunk-size", "10", "--chunk-overlap", "10");

        assertEquals(2, exit);
    }

    @Test
    void testUnknownOptionIsUsageError() {
        var cmd = new CommandLine(new NavigatorDaemon());
        cmd.setErr(new PrintWriter(new StringWriter()));

        assertEquals(2, cmd.execute("--bogus"));
    }
}
