package org.gudu0.whitelistbot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.gudu0.whitelistbot.commands.CommandTable;
import org.gudu0.whitelistbot.commands.WhitelistCommands;
import org.gudu0.whitelistbot.config.GlobalConfig;
import org.gudu0.whitelistbot.config.LegacyDataMigration;
import org.gudu0.whitelistbot.config.TypedConfigStore;
import org.gudu0.whitelistbot.console.ConsoleCommandService;
import org.gudu0.whitelistbot.export.CsvExporter;
import org.gudu0.whitelistbot.guild.GuildStore;
import org.gudu0.whitelistbot.ledger.AddressValidators;
import org.gudu0.whitelistbot.logging.LogService;
import org.gudu0.whitelistbot.router.MessageRouter;
import org.gudu0.whitelistbot.router.WhitelistListener;
import org.gudu0.whitelistbot.util.BotPaths;
import org.gudu0.whitelistbot.util.ConsoleLog;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public class Main {

    public static void main(String[] args) throws Exception {
        ConsoleLog.info("Main", "Starting Bot");
        BotPaths.ensureBaseDirs();

        // 1) Token (env)
        String token = reqEnv("DISCORD_TOKEN", "ACCESS_TOKEN");

        // 2) Global config (data/global/config.json)
        GlobalConfig globalCfg = loadOrCreateGlobalConfig();
        ConsoleLog.DEBUG = globalCfg.debug;
        ConsoleLog.info("Main", "GlobalConfig: eventThreads=" + globalCfg.eventThreads
                + " snapshotFile=" + globalCfg.snapshotFile
                + " exportDir=" + globalCfg.exportDir);

        Path snapshotPath = BotPaths.resolveData(globalCfg.snapshotFile);

        // 3) Optional: legacy migration (runs only if the legacy file exists and no snapshot does)
        LegacyDataMigration.migrateIfNeeded(BotPaths.resolveData(globalCfg.legacyDataFile), snapshotPath);

        // 4) Store
        GuildStore store = new GuildStore(snapshotPath);
        store.load();
        Runtime.getRuntime().addShutdownHook(new Thread(store::tryPersist, "SnapshotOnShutdown"));

        // 5) Services
        LogService logs = new LogService(BotPaths.OPERATIONS_LOG);
        CsvExporter exporter = new CsvExporter(BotPaths.resolveData(globalCfg.exportDir));
        CommandTable commands = CommandTable.of(new WhitelistCommands(store, exporter));
        MessageRouter router = new MessageRouter(store, commands, AddressValidators.defaults(), logs);

        // 6) Build JDA
        ConsoleLog.info("Main", "Building JDA (MESSAGE_CONTENT enabled)");
        JDA jda = JDABuilder.createDefault(token)
                .enableIntents(GatewayIntent.MESSAGE_CONTENT)
                .setEventPool(eventPool(globalCfg.eventThreads), true)
                .addEventListeners(new WhitelistListener(router, store, logs))
                .build();

        jda.awaitReady();
        ConsoleLog.info("Main", "JDA ready as " + jda.getSelfUser().getName());

        if (globalCfg.consoleCommands) {
            new ConsoleCommandService(store, jda).start();
        }

        ConsoleLog.info("Main", "Startup complete");
        logs.event("Startup", "Bot ready in " + jda.getGuilds().size() + " guild(s)");
    }

    private static GlobalConfig loadOrCreateGlobalConfig() {
        try {
            TypedConfigStore<GlobalConfig> s = new TypedConfigStore<>(BotPaths.GLOBAL_CONFIG, GlobalConfig.class, GlobalConfig::new);

            // TypedConfigStore loads defaults but DOES NOT write by itself.
            if (!s.existsOnDisk()) {
                ConsoleLog.warn("Main", "Global config missing; creating default at " + BotPaths.GLOBAL_CONFIG);
                s.save();
            }

            return s.cfg();
        } catch (Exception e) {
            ConsoleLog.error("Main", "Failed to load GlobalConfig; using defaults. " + e.getMessage(), e);
            return new GlobalConfig();
        }
    }

    private static ExecutorService eventPool(int threads) {
        AtomicInteger n = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "WhitelistEvents-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static String reqEnv(String... keys) {
        for (String key : keys) {
            String v = System.getenv(key);
            if (v != null && !v.isBlank()) return v;
        }
        throw new IllegalStateException("Missing environment variable: " + String.join(" or ", keys));
    }
}
