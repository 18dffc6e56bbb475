package org.gudu0.whitelistbot.commands;

import org.gudu0.whitelistbot.router.InboundMessage;

import java.io.IOException;

@FunctionalInterface
public interface CommandHandler {
    /**
     * Anything other than {@link CommandResult.Invalid} that goes wrong is thrown.
     */
    CommandResult handle(InboundMessage message, long guildId) throws IOException;
}
