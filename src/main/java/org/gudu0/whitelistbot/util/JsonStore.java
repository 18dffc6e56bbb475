package org.gudu0.whitelistbot.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.*;
import java.util.Optional;

/**
 * One JSON file on disk holding a whole value of type {@code T}.
 * <p>
 * Writes go to a sibling {@code .tmp} file first and are then moved over the target,
 * so a reader never sees a half-written file.
 */
public class JsonStore<T> {
    private final Path path;
    private final ObjectMapper om;
    private final Class<T> type;
    private final String nameForLogs;

    public JsonStore(Path path, Class<T> type, String nameForLogs) {
        this.path = path;
        this.type = type;
        this.nameForLogs = nameForLogs;
        this.om = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path path() {
        return path;
    }

    public boolean exists() {
        return Files.exists(path);
    }

    /**
     * Reads the file. Empty if it does not exist; throws if it exists but can't be parsed.
     */
    public Optional<T> read() throws IOException {
        if (!Files.exists(path)) {
            ConsoleLog.warn("JsonStore", nameForLogs + " missing at " + path);
            return Optional.empty();
        }
        T value = om.readValue(path.toFile(), type);
        ConsoleLog.info("JsonStore", "Loaded " + nameForLogs + " from " + path);
        return Optional.ofNullable(value);
    }

    public synchronized void write(T value) throws IOException {
        ConsoleLog.debug("JsonStore", "Writing " + nameForLogs + " -> " + path);

        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");

        om.writeValue(tmp.toFile(), value);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        ConsoleLog.debug("JsonStore", "Wrote " + nameForLogs);
    }
}
