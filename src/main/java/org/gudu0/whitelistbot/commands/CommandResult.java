package org.gudu0.whitelistbot.commands;

import org.gudu0.whitelistbot.router.ReplyPayload;

/**
 * Outcome of a command handler: either a reply to send, or "the arguments were wrong".
 */
public interface CommandResult {

    record Reply(ReplyPayload payload) implements CommandResult {}

    /** Shape problem with a recognized command. The router answers with a generic notice. */
    record Invalid(String reason) implements CommandResult {}

    static CommandResult reply(ReplyPayload payload) {
        return new Reply(payload);
    }

    static CommandResult invalid(String reason) {
        return new Invalid(reason);
    }
}
