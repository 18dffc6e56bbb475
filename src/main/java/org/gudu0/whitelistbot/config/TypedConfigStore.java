package org.gudu0.whitelistbot.config;

import org.gudu0.whitelistbot.util.ConsoleLog;
import org.gudu0.whitelistbot.util.JsonStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Loads a config object from JSON, falling back to defaults. Does not write unless {@link #save()} is called.
 */
public class TypedConfigStore<T> {
    private final JsonStore<T> file;
    private final Supplier<T> defaults;

    private final T cfg;

    public TypedConfigStore(Path path, Class<T> type, Supplier<T> defaults) {
        this.file = new JsonStore<>(path, type, path.getFileName().toString());
        this.defaults = defaults;
        this.cfg = loadOrNew();
    }

    public T cfg() { return cfg; }

    public boolean existsOnDisk() {
        return file.exists();
    }

    public synchronized void save() throws IOException {
        file.write(cfg);
        ConsoleLog.debug("TypedConfigStore", "Saved config to " + file.path());
    }

    private T loadOrNew() {
        try {
            T loaded = file.read().orElse(null);
            if (loaded != null) return loaded;
        } catch (Exception e) {
            ConsoleLog.error("TypedConfigStore", "Failed to load " + file.path() + ", using defaults: " + e.getMessage(), e);
            return defaults.get();
        }
        ConsoleLog.warn("TypedConfigStore", "Config missing: " + file.path() + " (will use defaults until saved)");
        return defaults.get();
    }
}
