package org.gudu0.whitelistbot.guild;

import org.gudu0.whitelistbot.ledger.LedgerType;

/**
 * The configurable part of a guild's config, without the entries.
 */
public record GuildSettings(Long whitelistChannel, Long whitelistRole, LedgerType ledgerType, int entryCount) {}
