package org.gudu0.whitelistbot.util;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Console logger used across the bot. Lines look like
 * <pre>
 * [2024-01-01 12:00:00.000] [INFO] [GuildStore] [WhitelistEvents-2] Loaded 3 guild(s) ...
 * </pre>
 * Events are handled on a pool, so every line carries the thread that wrote it.
 */
public final class ConsoleLog {
    private ConsoleLog() {}

    /** Toggled from {@code GlobalConfig.debug} at startup. */
    public static volatile boolean DEBUG = false;

    enum Level {
        INFO(null, false),
        WARN("93m", false),
        DEBUG("32m", false),
        ERROR("31m", true);

        private static final String ESC = "\u001B[";

        private final String colour;
        private final boolean toStderr;

        Level(String colour, boolean toStderr) {
            this.colour = colour;
            this.toStderr = toStderr;
        }

        String label() {
            return colour == null ? name() : ESC + colour + name() + ESC + "0m";
        }

        PrintStream stream() {
            return toStderr ? System.err : System.out;
        }
    }

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
                    .withZone(ZoneId.systemDefault());

    static String format(Level level, String tag, String msg) {
        return "[" + TS.format(Instant.now()) + "] [" + level.label() + "] [" + tag + "] ["
                + Thread.currentThread().getName() + "] " + msg;
    }

    private static void log(Level level, String tag, String msg, Throwable t) {
        PrintStream out = level.stream();
        // one println per record so lines from different event threads don't interleave mid-line
        out.println(format(level, tag, msg));
        if (t != null) t.printStackTrace(out);
    }

    public static void info(String tag, String msg) {
        log(Level.INFO, tag, msg, null);
    }

    public static void warn(String tag, String msg) {
        log(Level.WARN, tag, msg, null);
    }

    public static void debug(String tag, String msg) {
        if (!DEBUG) return;
        log(Level.DEBUG, tag, msg, null);
    }

    public static void error(String tag, String msg) {
        log(Level.ERROR, tag, msg, null);
    }

    public static void error(String tag, String msg, Throwable t) {
        log(Level.ERROR, tag, msg, t);
    }
}
