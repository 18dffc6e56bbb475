package org.gudu0.whitelistbot.router;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.ISnowflake;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.events.guild.GuildJoinEvent;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.whitelistbot.guild.GuildStore;
import org.gudu0.whitelistbot.logging.LogService;
import org.gudu0.whitelistbot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDA side of the bot: turns gateway events into {@link InboundMessage}s for the {@link MessageRouter}
 * and keeps the store in sync with the guilds the bot is in.
 */
public class WhitelistListener extends ListenerAdapter {

    private final MessageRouter router;
    private final GuildStore store;
    private final LogService logs;

    public WhitelistListener(MessageRouter router, GuildStore store, LogService logs) {
        this.router = router;
        this.store = store;
        this.logs = logs;
    }

    @Override
    public void onReady(@NotNull ReadyEvent event) {
        ConsoleLog.info("Ready", "Logged in as " + event.getJDA().getSelfUser().getName()
                + " (" + event.getJDA().getSelfUser().getId() + ")");
        ConsoleLog.info("Ready", "Initialising...");

        int added = 0;
        for (Guild g : event.getJDA().getGuilds()) {
            if (store.ensure(g.getIdLong())) {
                ConsoleLog.info("Ready", "Adding guild '" + g.getName() + "' to data.");
                added++;
            }
        }
        if (added > 0) store.tryPersist();

        ConsoleLog.info("Ready", "Guilds=" + event.getJDA().getGuilds().size() + " newlyAdded=" + added);
    }

    @Override
    public void onGuildJoin(@NotNull GuildJoinEvent event) {
        Guild g = event.getGuild();
        if (store.ensure(g.getIdLong())) store.tryPersist();
        logs.event("New Guild", g.getId() + ", " + g.getName());
    }

    @Override
    public void onMessageReceived(@NotNull MessageReceivedEvent event) {
        if (!event.isFromGuild()) return;

        InboundMessage msg;
        try {
            msg = toInbound(event);
        } catch (Exception e) {
            logs.fault(e, "Malformed message event messageId=" + event.getMessageId()
                    + "\nContent:   " + event.getMessage().getContentRaw());
            return;
        }
        router.route(msg, new MessageReplies(event.getMessage()));
    }

    static InboundMessage toInbound(MessageReceivedEvent event) {
        Message message = event.getMessage();
        Member member = event.getMember();

        Set<Long> roleIds = member == null
                ? Set.of()
                : member.getRoles().stream().map(ISnowflake::getIdLong).collect(Collectors.toSet());

        List<Long> channelMentions = message.getMentions().getChannels().stream()
                .map(ISnowflake::getIdLong)
                .collect(Collectors.toList());
        List<Long> roleMentions = message.getMentions().getRoles().stream()
                .map(ISnowflake::getIdLong)
                .collect(Collectors.toList());

        return new InboundMessage(
                event.getGuild().getIdLong(),
                event.getGuild().getName(),
                event.getChannel().getIdLong(),
                event.getMessageIdLong(),
                event.getAuthor().getIdLong(),
                event.getAuthor().isBot(),
                member != null,
                member != null && member.hasPermission(Permission.ADMINISTRATOR),
                roleIds,
                message.getContentRaw(),
                channelMentions,
                roleMentions
        );
    }
}
