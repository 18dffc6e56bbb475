package org.gudu0.whitelistbot.router;

/**
 * Sends replies back to the channel of one inbound message.
 */
@FunctionalInterface
public interface Replier {
    void send(ReplyPayload payload);
}
