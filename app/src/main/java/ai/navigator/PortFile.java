package ai.navigator;

import ai.navigator.util.FileUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** The {@code .rlm/port} file through which clients discover a running daemon. */
public final class PortFile {
    private static final Logger logger = LogManager.getLogger(PortFile.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public record Contents(@JsonProperty("port") int port, @JsonProperty("pid") long pid) {}

    private final Path file;

    public PortFile(Path rlmDir) {
        this.file = rlmDir.resolve("port");
    }

    public Path file() {
        return file;
    }

    public void write(int port) throws IOException {
        var contents = new Contents(port, ProcessHandle.current().pid());
        FileUtil.writeAtomically(file, objectMapper.writeValueAsBytes(contents));
        logger.info("Wrote port file {} (port {})", file, port);
    }

    public Optional<Contents> read() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Contents.class));
        } catch (IOException e) {
            logger.warn("Unreadable port file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Removes the file if it still names this process. */
    public void delete() {
        var current = read();
        if (current.isPresent() && current.get().pid() != ProcessHandle.current().pid()) {
            logger.info("Port file {} belongs to pid {}; leaving it", file, current.get().pid());
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not delete port file {}", file, e);
        }
    }
}
