package org.gudu0.whitelistbot.router;

import java.util.List;
import java.util.Set;

/**
 * What the router needs to know about one guild message, detached from JDA.
 *
 * @param authorIsMember false for webhooks and anything without a guild member behind it
 * @param authorIsAdmin  author has the ADMINISTRATOR permission in the guild
 */
public record InboundMessage(
        long guildId,
        String guildName,
        long channelId,
        long messageId,
        long authorId,
        boolean authorIsBot,
        boolean authorIsMember,
        boolean authorIsAdmin,
        Set<Long> authorRoleIds,
        String content,
        List<Long> mentionedChannelIds,
        List<Long> mentionedRoleIds
) {
    public InboundMessage {
        content = content == null ? "" : content;
        authorRoleIds = authorRoleIds == null ? Set.of() : Set.copyOf(authorRoleIds);
        mentionedChannelIds = mentionedChannelIds == null ? List.of() : List.copyOf(mentionedChannelIds);
        mentionedRoleIds = mentionedRoleIds == null ? List.of() : List.copyOf(mentionedRoleIds);
    }

    public boolean hasRole(long roleId) {
        return authorRoleIds.contains(roleId);
    }

    /** Short form for logs. */
    public String describe() {
        return "guildId=" + guildId
                + " channelId=" + channelId
                + " messageId=" + messageId
                + " authorId=" + authorId
                + " admin=" + authorIsAdmin;
    }
}
