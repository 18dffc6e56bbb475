package org.gudu0.whitelistbot.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.gudu0.whitelistbot.guild.GuildSnapshot;
import org.gudu0.whitelistbot.ledger.LedgerType;
import org.gudu0.whitelistbot.util.ConsoleLog;
import org.gudu0.whitelistbot.util.JsonStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

public final class LegacyDataMigration {
    private LegacyDataMigration() {}

    /**
     * One-time migration of the old single-file format:
     * <pre>
     * { "&lt;guildId&gt;": { "whitelist_channel": 1, "whitelist_role": 2, "blockchain": "eth", "data": { "&lt;userId&gt;": "0x.." } } }
     * </pre>
     * into the guild snapshot.
     * <p>
     * Safe: does nothing if the snapshot already exists or the legacy file is missing.
     *
     * @return true if a snapshot was written
     */
    public static boolean migrateIfNeeded(Path legacyFile, Path snapshotFile) {
        try {
            if (!Files.exists(legacyFile)) {
                ConsoleLog.debug("LegacyMigration", "Legacy data not found: " + legacyFile);
                return false;
            }
            if (Files.exists(snapshotFile)) {
                ConsoleLog.info("LegacyMigration", "Snapshot already exists (kept): " + snapshotFile);
                return false;
            }

            JsonNode root = new ObjectMapper().readTree(legacyFile.toFile());
            if (root == null || !root.isObject()) {
                ConsoleLog.warn("LegacyMigration", "Legacy data is not a JSON object; skipping: " + legacyFile);
                return false;
            }

            GuildSnapshot snapshot = new GuildSnapshot();
            Iterator<Map.Entry<String, JsonNode>> it = root.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                long guildId;
                try {
                    guildId = Long.parseLong(e.getKey());
                } catch (NumberFormatException nfe) {
                    ConsoleLog.warn("LegacyMigration", "Skipping non-numeric guild key: " + e.getKey());
                    continue;
                }
                snapshot.guilds.put(guildId, convertGuild(guildId, e.getValue()));
            }

            new JsonStore<>(snapshotFile, GuildSnapshot.class, "guild snapshot").write(snapshot);
            ConsoleLog.warn("LegacyMigration", "Migrated legacy data (" + snapshot.guilds.size() + " guilds) "
                    + legacyFile + " -> " + snapshotFile);
            return true;
        } catch (Exception e) {
            ConsoleLog.error("LegacyMigration", "Migration failed (starting from current snapshot): " + e.getMessage(), e);
            return false;
        }
    }

    private static GuildConfig convertGuild(long guildId, JsonNode g) {
        GuildConfig cfg = new GuildConfig();
        cfg.whitelistChannel = idOrNull(g.get("whitelist_channel"));
        cfg.whitelistRole = idOrNull(g.get("whitelist_role"));

        JsonNode chain = g.get("blockchain");
        if (chain != null && chain.isTextual()) {
            cfg.ledgerType = LedgerType.fromCode(chain.asText()).orElse(null);
            if (cfg.ledgerType == null) {
                ConsoleLog.warn("LegacyMigration", "guildId=" + guildId + " unknown blockchain '" + chain.asText() + "' (left unset)");
            }
        }

        JsonNode data = g.get("data");
        if (data != null && data.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = data.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                try {
                    cfg.entries.put(Long.parseLong(e.getKey()), e.getValue().asText());
                } catch (NumberFormatException nfe) {
                    ConsoleLog.warn("LegacyMigration", "guildId=" + guildId + " skipping non-numeric user key: " + e.getKey());
                }
            }
        }
        return cfg;
    }

    private static Long idOrNull(JsonNode n) {
        if (n == null || n.isNull()) return null;
        if (n.canConvertToLong()) return n.asLong();
        if (n.isTextual()) {
            try {
                return Long.parseLong(n.asText());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
