package org.gudu0.whitelistbot.guild;

import org.gudu0.whitelistbot.config.GuildConfig;
import org.gudu0.whitelistbot.util.ConsoleLog;
import org.gudu0.whitelistbot.util.JsonStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Owns every guild's {@link GuildConfig} and the snapshot file they are saved to.
 * <p>
 * Published configs are never modified: a mutation works on a copy and swaps it in. Readers get their own copy.
 * Mutations for one guild run one at a time in arrival order (fair lock); different guilds don't block each other.
 * The snapshot is written while the guild lock is still held, so for a given guild the in-memory change and the
 * write that contains it can't be reordered against another mutation of that guild.
 * <p>
 * Lock order is always guild lock, then snapshot lock.
 */
public final class GuildStore {

    private final ConcurrentHashMap<Long, GuildConfig> configs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Object snapshotLock = new Object();

    private final JsonStore<GuildSnapshot> snapshot;

    public GuildStore(Path snapshotPath) {
        this.snapshot = new JsonStore<>(snapshotPath, GuildSnapshot.class, "guild snapshot");
    }

    /**
     * Detached copy of the guild's config. Creates the default config on first access.
     */
    public GuildConfig get(long guildId) {
        return configs.computeIfAbsent(guildId, this::createDefault).copy();
    }

    /**
     * Channel/role/ledger type without copying the entries. Creates the default config on first access.
     */
    public GuildSettings settings(long guildId) {
        GuildConfig cfg = configs.computeIfAbsent(guildId, this::createDefault);
        return new GuildSettings(cfg.whitelistChannel, cfg.whitelistRole, cfg.ledgerType, cfg.entries.size());
    }

    /** The member's recorded address, if any. */
    public Optional<String> entry(long guildId, long userId) {
        GuildConfig cfg = configs.computeIfAbsent(guildId, this::createDefault);
        return Optional.ofNullable(cfg.entries.get(userId));
    }

    /**
     * Makes sure the guild has a config.
     *
     * @return true if it was just created
     */
    public boolean ensure(long guildId) {
        boolean[] created = {false};
        configs.computeIfAbsent(guildId, id -> {
            created[0] = true;
            return createDefault(id);
        });
        return created[0];
    }

    public void mutate(long guildId, Consumer<GuildConfig> fn) {
        mutateAndGet(guildId, cfg -> {
            fn.accept(cfg);
            return null;
        });
    }

    /**
     * Applies {@code fn} to a copy of the guild's config, publishes it and writes the snapshot.
     * If {@code fn} throws, nothing is published and the exception propagates.
     * A failed snapshot write is logged; the in-memory change stays.
     */
    public <R> R mutateAndGet(long guildId, Function<GuildConfig, R> fn) {
        ReentrantLock lock = locks.computeIfAbsent(guildId, id -> new ReentrantLock(true));
        lock.lock();
        try {
            GuildConfig working = configs.computeIfAbsent(guildId, this::createDefault).copy();
            R result = fn.apply(working);
            configs.put(guildId, working);
            ConsoleLog.debug("GuildStore", "Mutated guildId=" + guildId + " entries=" + working.entries.size());

            tryPersist();
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrites the snapshot with the current state of every guild.
     */
    public void persist() throws IOException {
        synchronized (snapshotLock) {
            GuildSnapshot out = new GuildSnapshot();
            // Published configs are immutable, so sharing them with the writer is fine.
            out.guilds = new TreeMap<>(configs);
            snapshot.write(out);
        }
    }

    /**
     * {@link #persist()} that logs instead of throwing.
     */
    public boolean tryPersist() {
        try {
            persist();
            return true;
        } catch (Exception e) {
            ConsoleLog.error("GuildStore", "Snapshot write failed (" + snapshot.path() + "): " + e.getMessage(), e);
            return false;
        }
    }

    /**
     * Loads the snapshot into memory. A missing snapshot leaves the store empty; an unreadable one is logged and
     * also leaves it empty.
     *
     * @return number of guilds loaded
     */
    public int load() {
        try {
            GuildSnapshot loaded = snapshot.read().orElse(null);
            if (loaded == null || loaded.guilds == null) {
                ConsoleLog.info("GuildStore", "No snapshot yet; starting empty.");
                return 0;
            }
            loaded.guilds.forEach((guildId, cfg) -> {
                if (cfg == null) cfg = new GuildConfig();
                if (cfg.entries == null) cfg.entries = new TreeMap<>();
                configs.put(guildId, cfg);
            });
            ConsoleLog.info("GuildStore", "Loaded " + loaded.guilds.size() + " guild(s) from " + snapshot.path());
            return loaded.guilds.size();
        } catch (Exception e) {
            ConsoleLog.error("GuildStore", "Failed to load snapshot " + snapshot.path() + ", starting empty: " + e.getMessage(), e);
            return 0;
        }
    }

    public Set<Long> guildIds() {
        return new TreeSet<>(configs.keySet());
    }

    public int size() {
        return configs.size();
    }

    public Path snapshotPath() {
        return snapshot.path();
    }

    private GuildConfig createDefault(long guildId) {
        ConsoleLog.info("GuildStore", "Creating default config guildId=" + guildId);
        return new GuildConfig();
    }
}
