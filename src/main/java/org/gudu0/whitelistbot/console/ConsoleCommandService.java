package org.gudu0.whitelistbot.console;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import org.gudu0.whitelistbot.guild.GuildSettings;
import org.gudu0.whitelistbot.guild.GuildStore;
import org.gudu0.whitelistbot.util.ConsoleLog;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class ConsoleCommandService {

    private final GuildStore store;
    private final JDA jda;
    private final InputStream in;

    private volatile boolean running = true;

    public ConsoleCommandService(GuildStore store, JDA jda) {
        this(store, jda, System.in);
    }

    ConsoleCommandService(GuildStore store, JDA jda, InputStream in) {
        this.store = store;
        this.jda = jda;
        this.in = in;
    }

    public void start() {
        Thread t = new Thread(this::runLoop, "ConsoleCommandService");
        t.setDaemon(true); // don't prevent JVM shutdown
        t.start();

        ConsoleLog.info("Console", "Console commands enabled. Type 'help' for commands.");
    }

    public void stop() {
        running = false;
    }

    void runLoop() {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(in, StandardCharsets.UTF_8))) {

            while (running) {
                String line = br.readLine(); // blocks waiting for input
                if (line == null) {
                    ConsoleLog.warn("Console", "STDIN closed; console commands disabled.");
                    return;
                }

                line = line.trim();
                if (line.isEmpty()) continue;

                handle(line);
            }
        } catch (Exception e) {
            ConsoleLog.error("Console", "Console command loop crashed: " + e.getMessage(), e);
        }
    }

    void handle(String raw) {
        String[] parts = raw.trim().split("\\s+");
        String cmd = parts[0].toLowerCase(Locale.ROOT);

        switch (cmd) {
            case "help" -> printHelp();

            case "listguilds", "guilds" -> listGuilds();

            case "guild" -> {
                if (parts.length < 2) {
                    ConsoleLog.warn("Console", "Usage: guild <guildId> [status]");
                    return;
                }
                long guildId;
                try {
                    guildId = Long.parseLong(parts[1]);
                } catch (NumberFormatException e) {
                    ConsoleLog.warn("Console", "Invalid guildId: " + parts[1]);
                    return;
                }

                String sub = (parts.length >= 3) ? parts[2].toLowerCase(Locale.ROOT) : "status";
                if (sub.equals("status")) {
                    guildStatus(guildId);
                } else {
                    ConsoleLog.warn("Console", "Unknown guild subcommand: " + sub + " (try: status)");
                }
            }

            case "save" -> {
                if (store.tryPersist()) {
                    ConsoleLog.info("Console", "Snapshot written: " + store.snapshotPath() + " (" + store.size() + " guilds)");
                }
            }

            case "shutdown", "exit" -> {
                ConsoleLog.warn("Console", "Shutdown requested from console.");
                store.tryPersist();
                jda.shutdown();
                System.exit(0);
            }

            default -> ConsoleLog.warn("Console", "Unknown command: " + cmd + " (type 'help')");
        }
    }

    private void printHelp() {
        ConsoleLog.info("Console", """
                Commands:
                  help                    - show this help
                  listguilds|guilds       - list guilds the bot is in
                  guild <id> [status]     - show per-guild whitelist config
                  save                    - write the guild snapshot now
                  shutdown|exit           - save and terminate process

                Examples:
                  guilds
                  guild 712304553931833385 status
                """.trim());
    }

    private void listGuilds() {
        var gs = jda.getGuilds();
        ConsoleLog.info("Console", "Guilds (" + gs.size() + "), stored configs=" + store.size() + ":");
        for (Guild g : gs) {
            ConsoleLog.info("Console", " - " + g.getName() + " | " + g.getId());
        }
    }

    private void guildStatus(long guildId) {
        Guild g = jda.getGuildById(guildId);
        if (g == null) {
            ConsoleLog.warn("Console", "Bot is not in guildId=" + guildId);
            return;
        }

        GuildSettings s = store.settings(guildId);

        ConsoleLog.info("Console", "Guild status: " + g.getName() + " (" + guildId + ")");
        ConsoleLog.info("Console", "  whitelistChannel=" + (s.whitelistChannel() == null ? "(not set)" : s.whitelistChannel()));
        ConsoleLog.info("Console", "  whitelistRole=" + (s.whitelistRole() == null ? "(not set)" : s.whitelistRole()));
        ConsoleLog.info("Console", "  blockchain=" + (s.ledgerType() == null ? "(not set)" : s.ledgerType().code()));
        ConsoleLog.info("Console", "  entries=" + s.entryCount());
    }
}
