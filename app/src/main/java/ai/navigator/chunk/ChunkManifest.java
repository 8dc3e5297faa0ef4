package ai.navigator.chunk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Describes the chunk files written for one source file.
 *
 * @param mtime source modification time (epoch millis) when the chunks were generated
 */
public record ChunkManifest(
        String path,
        @JsonProperty("total_lines") int totalLines,
        @JsonProperty("chunk_size") int chunkSize,
        int overlap,
        @JsonProperty("total_chunks") int totalChunks,
        long mtime) {

    public boolean isCurrent(long sourceMtime, int size, int overlap) {
        return mtime == sourceMtime && chunkSize == size && this.overlap == overlap;
    }
}
