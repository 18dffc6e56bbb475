package org.gudu0.whitelistbot.guild;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.gudu0.whitelistbot.config.GuildConfig;

import java.util.Map;
import java.util.TreeMap;

/**
 * On-disk shape of the whole store: guildId -> config.
 */
public class GuildSnapshot {
    @JsonDeserialize(as = TreeMap.class)
    public Map<Long, GuildConfig> guilds = new TreeMap<>();
}
