package ai.navigator.chunk;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkWindowsTest {

    @Test
    void testDefaultWindowsCoverEveryLine() {
        var windows = ChunkWindows.windows(450, 200, 20);

        assertEquals(
                List.of(
                        new ChunkWindows.Window(0, 1, 200),
                        new ChunkWindows.Window(1, 181, 380),
                        new ChunkWindows.Window(2, 361, 450)),
                windows);
        assertEquals(3, ChunkWindows.totalChunks(450, 200, 20));
    }

    @Test
    void testConsecutiveWindowsOverlapExactly() {
        for (int totalLines : new int[] {1, 19, 20, 21, 199, 200, 201, 380, 381, 1000, 12345}) {
            var windows = ChunkWindows.windows(totalLines, 200, 20);
            assertEquals(1, windows.get(0).start());
            assertEquals(totalLines, windows.get(windows.size() - 1).end(), "last window ends at " + totalLines);
            for (int i = 1; i < windows.size(); i++) {
                var prev = windows.get(i - 1);
                var next = windows.get(i);
                assertEquals(20, prev.end() - next.start() + 1, "overlap between " + prev + " and " + next);
            }
        }
    }

    @Test
    void testSmallFilesProduceOneChunk() {
        assertEquals(1, ChunkWindows.totalChunks(1, 200, 20));
        assertEquals(1, ChunkWindows.totalChunks(200, 200, 20));
        assertEquals(2, ChunkWindows.totalChunks(201, 200, 20));
        assertEquals("1-5", ChunkWindows.window(0, 5, 200, 20).lines());
    }

    @Test
    void testEmptyFileHasNoChunks() {
        assertEquals(0, ChunkWindows.totalChunks(0, 200, 20));
        assertTrue(ChunkWindows.windows(0, 200, 20).isEmpty());
    }

    @Test
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> ChunkWindows.validate(0, 0));
        assertThrows(IllegalArgumentException.class, () -> ChunkWindows.validate(10, -1));
        assertThrows(IllegalArgumentException.class, () -> ChunkWindows.validate(10, 10));
        assertDoesNotThrow(() -> ChunkWindows.validate(10, 0));
    }

    @Test
    void testWindowOutOfRange() {
        assertThrows(IndexOutOfBoundsException.class, () -> ChunkWindows.window(3, 450, 200, 20));
        assertThrows(IndexOutOfBoundsException.class, () -> ChunkWindows.window(-1, 450, 200, 20));
    }
}
