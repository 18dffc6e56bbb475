package org.gudu0.whitelistbot.guild;

import org.gudu0.whitelistbot.config.GuildConfig;
import org.gudu0.whitelistbot.ledger.LedgerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuildStoreTest {

    private static final long GUILD = 42L;

    @TempDir
    Path dir;

    private GuildStore newStore() {
        return new GuildStore(dir.resolve("whitelist.json"));
    }

    @Test
    @DisplayName("first access creates an empty default config")
    void firstAccessCreatesDefault() {
        GuildStore store = newStore();

        GuildConfig cfg = store.get(GUILD);

        assertThat(cfg.whitelistChannel).isNull();
        assertThat(cfg.whitelistRole).isNull();
        assertThat(cfg.ledgerType).isNull();
        assertThat(cfg.entries).isEmpty();
        assertThat(store.guildIds()).containsExactly(GUILD);
    }

    @Test
    @DisplayName("ensure reports whether the guild was new")
    void ensureReportsCreation() {
        GuildStore store = newStore();

        assertThat(store.ensure(GUILD)).isTrue();
        assertThat(store.ensure(GUILD)).isFalse();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("get hands out copies; changing them does not touch the store")
    void getReturnsDetachedCopy() {
        GuildStore store = newStore();
        store.mutate(GUILD, cfg -> cfg.entries.put(1L, "a"));

        GuildConfig copy = store.get(GUILD);
        copy.entries.put(2L, "b");
        copy.whitelistChannel = 99L;

        assertThat(store.get(GUILD).entries).containsOnlyKeys(1L);
        assertThat(store.settings(GUILD).whitelistChannel()).isNull();
    }

    @Test
    @DisplayName("mutate writes the snapshot; a fresh store loads the same configs")
    void persistLoadRoundTrip() {
        GuildStore store = newStore();
        store.mutate(GUILD, cfg -> {
            cfg.whitelistChannel = 10L;
            cfg.whitelistRole = 20L;
            cfg.ledgerType = LedgerType.ETH;
            cfg.entries.put(5L, "0x742d35Cc6634C0532925a3b844Bc454e4438f44e");
        });
        store.mutate(7L, cfg -> cfg.ledgerType = LedgerType.SOL);

        assertThat(store.snapshotPath()).exists();

        GuildStore reloaded = newStore();
        assertThat(reloaded.load()).isEqualTo(2);

        assertThat(reloaded.get(GUILD)).usingRecursiveComparison().isEqualTo(store.get(GUILD));
        assertThat(reloaded.get(7L)).usingRecursiveComparison().isEqualTo(store.get(7L));
    }

    @Test
    @DisplayName("snapshot is human-readable JSON keyed by guild id with the ledger code")
    void snapshotFormat() throws Exception {
        GuildStore store = newStore();
        store.mutate(GUILD, cfg -> cfg.ledgerType = LedgerType.ETH);

        String json = Files.readString(store.snapshotPath());

        assertThat(json).contains("\"guilds\"").contains("\"42\"").contains("\"eth\"");
    }

    @Test
    @DisplayName("missing or corrupt snapshot starts empty")
    void loadMissingOrCorrupt() throws Exception {
        assertThat(newStore().load()).isZero();

        Files.writeString(dir.resolve("whitelist.json"), "{ not json");
        GuildStore store = newStore();
        assertThat(store.load()).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("clearing resets the config to default")
    void resetClearsEverything() {
        GuildStore store = newStore();
        store.mutate(GUILD, cfg -> {
            cfg.whitelistChannel = 1L;
            cfg.entries.put(1L, "x");
        });

        store.mutate(GUILD, GuildConfig::reset);

        assertThat(store.get(GUILD)).usingRecursiveComparison().isEqualTo(new GuildConfig());
    }

    @Test
    @DisplayName("a mutation that throws publishes nothing")
    void throwingMutationIsDiscarded() {
        GuildStore store = newStore();
        store.mutate(GUILD, cfg -> cfg.entries.put(1L, "kept"));

        assertThatThrownBy(() -> store.mutate(GUILD, cfg -> {
            cfg.entries.put(1L, "lost");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(store.entry(GUILD, 1L)).contains("kept");
    }

    @Test
    @DisplayName("failed snapshot write keeps the in-memory change and later mutations still work")
    void persistFailureDoesNotRollBack() throws Exception {
        Path blocker = dir.resolve("not-a-dir");
        Files.writeString(blocker, "file in the way");
        GuildStore store = new GuildStore(blocker.resolve("whitelist.json"));

        store.mutate(GUILD, cfg -> cfg.entries.put(1L, "first"));
        store.mutate(GUILD, cfg -> cfg.entries.put(2L, "second"));

        assertThat(store.tryPersist()).isFalse();
        assertThat(store.get(GUILD).entries).containsEntry(1L, "first").containsEntry(2L, "second");
    }

    @Test
    @DisplayName("two writers for the same member: the stored value is one of the two, never lost or mixed")
    void concurrentSameMemberSubmissions() throws Exception {
        GuildStore store = newStore();
        CountDownLatch firstInside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> a = pool.submit(() -> store.mutate(GUILD, cfg -> {
                firstInside.countDown();
                await(release); // suspended between read and write
                cfg.entries.put(1L, "A");
            }));
            assertThat(firstInside.await(5, TimeUnit.SECONDS)).isTrue();

            Future<?> b = pool.submit(() -> store.mutate(GUILD, cfg -> cfg.entries.put(1L, "B")));

            release.countDown();
            a.get(5, TimeUnit.SECONDS);
            b.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.entry(GUILD, 1L)).get().isIn("A", "B");
        // B waited for A, so B is the last write
        assertThat(store.entry(GUILD, 1L)).contains("B");
    }

    @Test
    @DisplayName("many concurrent writers to one guild never lose an entry")
    void noLostUpdates() throws Exception {
        GuildStore store = newStore();
        int writers = 64;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                long user = i;
                futures.add(pool.submit(() -> {
                    await(start);
                    store.mutate(GUILD, cfg -> cfg.entries.put(user, "addr-" + user));
                }));
            }
            start.countDown();
            for (Future<?> f : futures) f.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get(GUILD).entries).hasSize(writers);

        GuildStore reloaded = newStore();
        reloaded.load();
        assertThat(reloaded.get(GUILD).entries).hasSize(writers);
    }

    @Test
    @DisplayName("a slow mutation in one guild does not block another guild")
    void guildsAreIndependent() throws Exception {
        GuildStore store = newStore();
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> slow = pool.submit(() -> store.mutate(1L, cfg -> {
                inside.countDown();
                await(release);
                cfg.whitelistChannel = 1L;
            }));
            assertThat(inside.await(5, TimeUnit.SECONDS)).isTrue();

            Future<?> other = pool.submit(() -> store.mutate(2L, cfg -> cfg.whitelistChannel = 2L));
            other.get(5, TimeUnit.SECONDS);

            assertThat(store.settings(2L).whitelistChannel()).isEqualTo(2L);
            assertThat(store.settings(1L).whitelistChannel()).isNull();

            release.countDown();
            slow.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.settings(1L).whitelistChannel()).isEqualTo(1L);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) throw new IllegalStateException("latch timed out");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
