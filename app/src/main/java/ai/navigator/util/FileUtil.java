package ai.navigator.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class FileUtil {
    private static final Logger logger = LogManager.getLogger(FileUtil.class);

    /** Bytes inspected when deciding whether a file is text. */
    public static final int TEXT_SNIFF_BYTES = 8192;

    private FileUtil() {
        /* utility class – no instances */
    }

    /**
     * Deletes {@code path} and everything beneath it. Does **not** follow symlinks; logs but ignores individual delete
     * failures.
     */
    public static boolean deleteRecursively(Path path) {
        if (!Files.exists(path)) {
            return false;
        }

        try (Stream<Path> walk = Files.walk(path)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.delete(p);
                } catch (IOException e) {
                    logger.warn("Failed to delete {}", p, e);
                }
            });
            return !Files.exists(path);
        } catch (IOException e) {
            logger.error("Failed to walk or initiate deletion for directory: {}", path, e);
            return false;
        }
    }

    /** Writes {@code content} next to {@code target} and renames it into place. */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        var parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        var temp = parent.resolve("." + target.getFileName() + ".tmp");
        Files.write(temp, content);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    /** Last-modified time in epoch millis, or empty when the file does not exist. */
    public static OptionalLong mtimeMillis(Path path) {
        try {
            return OptionalLong.of(Files.getLastModifiedTime(path).toMillis());
        } catch (NoSuchFileException e) {
            return OptionalLong.empty();
        } catch (IOException e) {
            logger.debug("Could not stat {}: {}", path, e.getMessage());
            return OptionalLong.empty();
        }
    }

    /**
     * Splits content into lines, keeping each line's terminator. A trailing newline does not start an extra
     * empty line, so {@code "a\nb\n"} yields two lines.
     */
    public static List<String> splitLinesKeepEnds(String content) {
        var lines = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines.add(content.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < content.length()) {
            lines.add(content.substring(start));
        }
        return lines;
    }

    /** Removes a trailing {@code \n} or {@code \r\n}, nothing else. */
    public static String stripLineEnding(String line) {
        int end = line.length();
        if (end > 0 && line.charAt(end - 1) == '\n') {
            end--;
        }
        if (end > 0 && line.charAt(end - 1) == '\r') {
            end--;
        }
        return line.substring(0, end);
    }

    /** Line count with the same convention as {@link #splitLinesKeepEnds(String)}. */
    public static int countLines(byte[] content) {
        int count = 0;
        for (byte b : content) {
            if (b == '\n') {
                count++;
            }
        }
        if (content.length > 0 && content[content.length - 1] != '\n') {
            count++;
        }
        return count;
    }

    /** True when the first {@link #TEXT_SNIFF_BYTES} bytes contain no NUL. */
    public static boolean isLikelyText(Path path) {
        byte[] sample;
        try (InputStream in = Files.newInputStream(path)) {
            sample = in.readNBytes(TEXT_SNIFF_BYTES);
        } catch (IOException e) {
            return false;
        }
        return isLikelyText(sample, sample.length);
    }

    /** Only a NUL byte marks content as binary; text in a legacy encoding still counts as text. */
    public static boolean isLikelyText(byte[] content, int limit) {
        int n = Math.min(limit, content.length);
        for (int i = 0; i < n; i++) {
            if (content[i] == 0) {
                return false;
            }
        }
        return true;
    }

    /** Decodes UTF-8, substituting U+FFFD for malformed or unmappable sequences. */
    public static String decodeLenient(byte[] content) {
        try {
            return StandardCharsets.UTF_8
                    .newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalStateException("Replacing decoder reported a coding error", e);
        }
    }

    public static String readLenient(Path path) throws IOException {
        return decodeLenient(Files.readAllBytes(path));
    }

    /** Relative path rendered with forward slashes on every platform. */
    public static String toSlashPath(Path relPath) {
        return relPath.toString().replace('\\', '/');
    }
}
