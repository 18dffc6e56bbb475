package org.gudu0.whitelistbot.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.gudu0.whitelistbot.ledger.LedgerType;

import java.util.Map;
import java.util.TreeMap;

/**
 * Per-guild whitelist config and collected addresses.
 * <p>
 * Owned by {@link org.gudu0.whitelistbot.guild.GuildStore}; everything else only sees copies.
 */
public class GuildConfig {
    /** Channel where addresses are accepted. Null = not set. */
    public Long whitelistChannel;

    /** Role a member needs to submit. Null = not set. */
    public Long whitelistRole;

    /** Selects the address validator. Null = not set (every submission is rejected). */
    public LedgerType ledgerType;

    /** userId -> submitted address. */
    @JsonDeserialize(as = TreeMap.class)
    public Map<Long, String> entries = new TreeMap<>();

    public GuildConfig copy() {
        GuildConfig c = new GuildConfig();
        c.whitelistChannel = whitelistChannel;
        c.whitelistRole = whitelistRole;
        c.ledgerType = ledgerType;
        c.entries = new TreeMap<>(entries);
        return c;
    }

    /** Back to the freshly-joined state. */
    public void reset() {
        whitelistChannel = null;
        whitelistRole = null;
        ledgerType = null;
        entries = new TreeMap<>();
    }
}
