package org.gudu0.whitelistbot.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.gudu0.whitelistbot.util.ConsoleLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes a guild's entries as {@code userId,walletAddress} rows into the export staging dir.
 * Every export gets its own staging file, so two exports of one guild never share a path.
 */
public class CsvExporter {

    @JsonPropertyOrder({"userId", "walletAddress"})
    public record Row(String userId, String walletAddress) {}

    private final Path stagingDir;
    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema = mapper.schemaFor(Row.class).withHeader();

    public CsvExporter(Path stagingDir) {
        this.stagingDir = stagingDir;
    }

    /** Name the export is attached under. */
    public static String fileName(long guildId) {
        return guildId + ".csv";
    }

    /**
     * @return the written file, {@code <stagingDir>/<guildId>-<unique>.csv}. The caller removes it once it has been sent.
     */
    public Path export(long guildId, Map<Long, String> entries) throws IOException {
        Files.createDirectories(stagingDir);
        Path out = Files.createTempFile(stagingDir, guildId + "-", ".csv");

        try (SequenceWriter w = mapper.writer(schema).writeValues(out.toFile())) {
            for (Map.Entry<Long, String> e : new TreeMap<>(entries).entrySet()) {
                w.write(new Row(Long.toString(e.getKey()), e.getValue()));
            }
        }

        ConsoleLog.info("Export", "guildId=" + guildId + " wrote " + entries.size() + " row(s) -> " + out);
        return out;
    }
}
