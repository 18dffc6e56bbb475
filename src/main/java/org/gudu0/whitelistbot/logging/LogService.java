package org.gudu0.whitelistbot.logging;

import org.gudu0.whitelistbot.util.ConsoleLog;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Operational log: faults and guild lifecycle events.
 * <p>
 * Every record goes to the console and is appended to the log file as
 * <pre>
 * [timestamp] Head: ...
 *    Text: ...
 * </pre>
 */
public class LogService {
    public static final DateTimeFormatter TS = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    private final Path file;

    public LogService(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    /** Unexpected failure while handling something. Head is the flattened stack trace. */
    public void fault(Throwable t, String body) {
        ConsoleLog.error("Fault", body, t);
        append(flatten(t), body);
    }

    public void event(String head, String body) {
        ConsoleLog.info("LogService", head + ": " + body);
        append(head, body);
    }

    private synchronized void append(String head, String body) {
        String record = "[" + ZonedDateTime.now(ZoneId.systemDefault()).format(TS) + "] Head: " + head
                + "\n   Text: " + body + "\n\n";
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(file, record, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (Exception e) {
            ConsoleLog.error("LogService", "Failed appending to " + file + ": " + e.getMessage(), e);
        }
    }

    /** Stack trace on one line, frames separated by "---". */
    static String flatten(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString().stripTrailing().replace("\r", "").replace("\n", "---");
    }
}
