package ai.navigator.chunk;

import java.util.ArrayList;
import java.util.List;

/** Overlapping, fixed-size line windows over a file. All line numbers are 1-based and inclusive. */
public final class ChunkWindows {
    public static final int DEFAULT_SIZE = 200;
    public static final int DEFAULT_OVERLAP = 20;

    private ChunkWindows() {}

    public record Window(int index, int start, int end) {
        public String lines() {
            return start + "-" + end;
        }
    }

    public static void validate(int size, int overlap) {
        if (size < 1) {
            throw new IllegalArgumentException("Chunk size must be at least 1, got " + size);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("Overlap must not be negative, got " + overlap);
        }
        if (size <= overlap) {
            throw new IllegalArgumentException(
                    "Chunk size (%d) must be larger than overlap (%d)".formatted(size, overlap));
        }
    }

    public static int totalChunks(int totalLines, int size, int overlap) {
        validate(size, overlap);
        if (totalLines <= 0) {
            return 0;
        }
        int step = size - overlap;
        int remaining = totalLines - overlap;
        if (remaining <= 0) {
            return 1;
        }
        return Math.max(1, (remaining + step - 1) / step);
    }

    public static Window window(int index, int totalLines, int size, int overlap) {
        int count = totalChunks(totalLines, size, overlap);
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Chunk %d out of range (%d chunks)".formatted(index, count));
        }
        int start = index * (size - overlap) + 1;
        return new Window(index, start, Math.min(start + size - 1, totalLines));
    }

    public static List<Window> windows(int totalLines, int size, int overlap) {
        int count = totalChunks(totalLines, size, overlap);
        var result = new ArrayList<Window>(count);
        for (int i = 0; i < count; i++) {
            result.add(window(i, totalLines, size, overlap));
        }
        return List.copyOf(result);
    }
}
