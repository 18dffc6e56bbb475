package org.gudu0.whitelistbot.util;

import java.nio.file.Files;
import java.nio.file.Path;

public final class BotPaths {
    private BotPaths() {}

    // Root data dir
    public static final Path DATA = Path.of("data");

    public static final Path GLOBAL_DIR = DATA.resolve("global");
    public static final Path LOGS_DIR = DATA.resolve("logs");

    public static final Path GLOBAL_CONFIG = GLOBAL_DIR.resolve("config.json");
    public static final Path OPERATIONS_LOG = LOGS_DIR.resolve("bot.log");

    /** Resolves a configured file/dir name against {@link #DATA}; absolute names are used as-is. */
    public static Path resolveData(String name) {
        Path p = Path.of(name);
        return p.isAbsolute() ? p : DATA.resolve(p);
    }

    public static void ensureBaseDirs() {
        try {
            Files.createDirectories(GLOBAL_DIR);
            Files.createDirectories(LOGS_DIR);
            ConsoleLog.info("BotPaths", "Ensured data dirs: " + GLOBAL_DIR + " and " + LOGS_DIR);
        } catch (Exception e) {
            ConsoleLog.error("BotPaths", "Failed to create base data dirs: " + e.getMessage(), e);
        }
    }
}
