package org.gudu0.whitelistbot.commands;

import org.gudu0.whitelistbot.config.GuildConfig;
import org.gudu0.whitelistbot.export.CsvExporter;
import org.gudu0.whitelistbot.guild.GuildSettings;
import org.gudu0.whitelistbot.guild.GuildStore;
import org.gudu0.whitelistbot.ledger.LedgerType;
import org.gudu0.whitelistbot.router.InboundMessage;
import org.gudu0.whitelistbot.router.ReplyPayload;
import org.gudu0.whitelistbot.util.ConsoleLog;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Handlers for every {@link Command}. Setters and {@code >clear} change the guild through {@link GuildStore#mutate},
 * which also saves the snapshot; everything else only reads.
 */
public class WhitelistCommands {

    private static final Pattern CHANNEL_CMD = Pattern.compile(">channel <#\\d+>");
    private static final Pattern ROLE_CMD = Pattern.compile(">role <@&\\d+>");

    private static final String NOT_SET = "_not set_";

    private final GuildStore store;
    private final CsvExporter exporter;

    public WhitelistCommands(GuildStore store, CsvExporter exporter) {
        this.store = store;
        this.exporter = exporter;
    }

    // ----------------------------
    // Admin: config setters
    // ----------------------------

    public CommandResult setChannel(InboundMessage msg, long guildId) {
        List<Long> channels = msg.mentionedChannelIds();
        if (channels.size() != 1 || !CHANNEL_CMD.matcher(msg.content()).matches()) {
            return CommandResult.invalid("expected exactly one channel mention: >channel #channel");
        }
        long channelId = channels.get(0);
        store.mutate(guildId, cfg -> cfg.whitelistChannel = channelId);

        ConsoleLog.info("Commands", "guildId=" + guildId + " whitelistChannel=" + channelId);
        return CommandResult.reply(ReplyPayload.mention("Successfully set whitelist channel to <#" + channelId + ">"));
    }

    public CommandResult setRole(InboundMessage msg, long guildId) {
        List<Long> roles = msg.mentionedRoleIds();
        if (roles.size() != 1 || !ROLE_CMD.matcher(msg.content()).matches()) {
            return CommandResult.invalid("expected exactly one role mention: >role @role");
        }
        long roleId = roles.get(0);
        store.mutate(guildId, cfg -> cfg.whitelistRole = roleId);

        ConsoleLog.info("Commands", "guildId=" + guildId + " whitelistRole=" + roleId);
        return CommandResult.reply(ReplyPayload.mention("Successfully set whitelist role to <@&" + roleId + ">"));
    }

    public CommandResult setBlockchain(InboundMessage msg, long guildId) {
        String[] tokens = msg.content().trim().split("\\s+");
        if (tokens.length < 2) {
            return CommandResult.invalid("missing blockchain code");
        }
        Optional<LedgerType> type = LedgerType.fromCode(tokens[tokens.length - 1]);
        if (type.isEmpty()) {
            return CommandResult.invalid("unknown blockchain code: " + tokens[tokens.length - 1]);
        }
        LedgerType ledgerType = type.get();
        store.mutate(guildId, cfg -> cfg.ledgerType = ledgerType);

        ConsoleLog.info("Commands", "guildId=" + guildId + " ledgerType=" + ledgerType.code());
        return CommandResult.reply(ReplyPayload.mention("Successfully set blockchain to " + ledgerType.code()));
    }

    public CommandResult clear(InboundMessage msg, long guildId) {
        store.mutate(guildId, GuildConfig::reset);

        ConsoleLog.warn("Commands", "guildId=" + guildId + " config and data cleared by userId=" + msg.authorId());
        return CommandResult.reply(ReplyPayload.text("Server's data and config has been cleared."));
    }

    // ----------------------------
    // Admin: reads
    // ----------------------------

    public CommandResult showConfig(InboundMessage msg, long guildId) {
        GuildSettings s = store.settings(guildId);

        String channel = s.whitelistChannel() == null ? NOT_SET : "<#" + s.whitelistChannel() + ">";
        String role = s.whitelistRole() == null ? NOT_SET : "<@&" + s.whitelistRole() + ">";
        String chain = s.ledgerType() == null ? NOT_SET : s.ledgerType().code();

        String body = "Whitelist Channel: " + channel + "\n"
                + "Whitelist Role: " + role + "\n"
                + "Blockchain: " + chain + "\n"
                + "Recorded wallets: " + s.entryCount();

        return CommandResult.reply(new ReplyPayload.Embed("Config for " + msg.guildName(), body, List.of(), true));
    }

    public CommandResult exportData(InboundMessage msg, long guildId) throws IOException {
        GuildConfig cfg = store.get(guildId);
        Path file = exporter.export(guildId, cfg.entries);
        return CommandResult.reply(new ReplyPayload.Attachment(
                "Data for server is attached.", file, CsvExporter.fileName(guildId), false));
    }

    public CommandResult helpAdmin(InboundMessage msg, long guildId) {
        String desc = "Whitelist Manager is a bot designed to assist you in gathering wallet addresses for NFT drops.\n"
                + "After configuring the bot, users who are 'whitelisted' will be able to record their crypto addresses "
                + "which you can then download as a CSV.\n"
                + "Note, the `config` must be filled out before the bot will work.";
        return CommandResult.reply(new ReplyPayload.Embed(
                "Whitelist Manager Help (Admin)",
                desc,
                List.of(new ReplyPayload.Field("COMMANDS", commandLines(List.of(Command.values())), false)),
                false));
    }

    // ----------------------------
    // Public
    // ----------------------------

    public CommandResult help(InboundMessage msg, long guildId) {
        String body = commandLines(Command.inScope(Command.Scope.PUBLIC)) + "\n"
                + Command.HELP_ADMIN.usage() + ": Provides a help screen to assist in configuring the bot (admin only).\n\n"
                + "How to use: Send your wallet address to the whitelist chat to record it!\n"
                + "The message should contain just the wallet address (no `" + Command.SIGIL + "`).";
        return CommandResult.reply(new ReplyPayload.Embed(
                "Whitelist Manager Help",
                "Whitelist Manager is a bot designed to assist in gathering wallet addresses for NFT drops.",
                List.of(new ReplyPayload.Field("COMMANDS", body, false)),
                false));
    }

    public CommandResult check(InboundMessage msg, long guildId) {
        return store.entry(guildId, msg.authorId())
                .map(addr -> CommandResult.reply(ReplyPayload.text("You are whitelisted! Address: `" + addr + "`")))
                .orElseGet(() -> CommandResult.reply(ReplyPayload.text(
                        "Your wallet is not yet on the whitelist. Use `" + Command.SIGIL + "help` for more info!")));
    }

    private static String commandLines(List<Command> commands) {
        return commands.stream()
                .map(c -> c.usage() + ": " + c.description())
                .collect(Collectors.joining("\n"));
    }
}
