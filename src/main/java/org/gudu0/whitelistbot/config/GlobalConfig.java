package org.gudu0.whitelistbot.config;

/**
 * Global bot config (one per bot process).
 * Stored at: data/global/config.json
 * <p>
 * Keep the token in an environment variable, not here.
 */
public class GlobalConfig {
    /** Threads JDA uses to dispatch events. Events on different threads may interleave. */
    public int eventThreads = 4;

    /** Guild snapshot file, relative to data/. */
    public String snapshotFile = "whitelist.json";

    /** Staging dir for >data exports, relative to data/. */
    public String exportDir = "exports";

    /** Older single-file snapshot, relative to data/. Migrated once if the new snapshot is missing. */
    public String legacyDataFile = "data.json";

    public boolean consoleCommands = true;

    public boolean debug = false;
}
