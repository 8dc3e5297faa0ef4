package ai.navigator.index;

import ai.navigator.analyzer.Symbol;
import java.util.List;

/**
 * Cached extraction result for one file. Immutable; a change to the file replaces the whole record.
 *
 * @param path slash-separated path relative to the project root
 * @param contentHash SHA-256 hex of the bytes the skeleton was built from
 * @param mtime modification time of those bytes, epoch millis
 * @param size byte length of the content
 * @param generation cache-wide sequence number taken before the file was read; a newer record always wins
 */
public record FileRecord(
        String path,
        String contentHash,
        long mtime,
        long size,
        String language,
        String skeleton,
        List<Symbol> symbols,
        int totalLines,
        long generation) {

    public FileRecord {
        symbols = List.copyOf(symbols);
    }
}
