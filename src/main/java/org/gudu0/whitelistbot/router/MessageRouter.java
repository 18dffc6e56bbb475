package org.gudu0.whitelistbot.router;

import org.gudu0.whitelistbot.commands.Command;
import org.gudu0.whitelistbot.commands.CommandHandler;
import org.gudu0.whitelistbot.commands.CommandResult;
import org.gudu0.whitelistbot.commands.CommandTable;
import org.gudu0.whitelistbot.config.GuildConfig;
import org.gudu0.whitelistbot.guild.GuildSettings;
import org.gudu0.whitelistbot.guild.GuildStore;
import org.gudu0.whitelistbot.ledger.AddressValidators;
import org.gudu0.whitelistbot.logging.LogService;
import org.gudu0.whitelistbot.util.ConsoleLog;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides what an inbound guild message is and acts on it.
 * <p>
 * Order (first match wins):
 * <ol>
 *     <li>bot / non-member authors: ignored</li>
 *     <li>admin + sigil + known admin command: dispatched, no fallthrough</li>
 *     <li>sigil: public command, or the list of public commands</li>
 *     <li>plain text in the whitelist channel from a member with the whitelist role: address submission</li>
 * </ol>
 * Anything unexpected is logged through {@link LogService#fault} and the user gets no reply.
 */
public class MessageRouter {

    public enum Outcome {
        IGNORED,
        COMMAND,
        INVALID_COMMAND,
        UNKNOWN_COMMAND,
        RECORDED,
        REJECTED,
        FAILED
    }

    static final String INVALID_ARGUMENT = "Invalid command argument.";

    private final GuildStore store;
    private final CommandTable commands;
    private final AddressValidators validators;
    private final LogService logs;

    public MessageRouter(GuildStore store, CommandTable commands, AddressValidators validators, LogService logs) {
        this.store = store;
        this.commands = commands;
        this.validators = validators;
        this.logs = logs;
    }

    public Outcome route(InboundMessage msg, Replier replier) {
        try {
            Outcome outcome = classifyAndHandle(msg, replier);
            ConsoleLog.debug("Router", outcome + " " + msg.describe());
            return outcome;
        } catch (Exception e) {
            logs.fault(e, msg.describe() + "\nContent:   " + msg.content());
            return Outcome.FAILED;
        }
    }

    private Outcome classifyAndHandle(InboundMessage msg, Replier replier) throws Exception {
        // we do not want the bot to reply to itself (or to webhooks)
        if (msg.authorIsBot() || !msg.authorIsMember()) return Outcome.IGNORED;

        long guildId = msg.guildId();
        Optional<String> token = Command.tokenOf(msg.content());

        if (token.isPresent()) {
            if (msg.authorIsAdmin()) {
                Optional<CommandHandler> admin = commands.find(Command.Scope.ADMIN, token.get());
                if (admin.isPresent()) {
                    ConsoleLog.info("Router", "Admin command (from " + msg.authorId() + " guildId=" + guildId + "): " + msg.content());
                    return dispatch(admin.get(), msg, replier);
                }
            }

            Optional<CommandHandler> pub = commands.find(Command.Scope.PUBLIC, token.get());
            if (pub.isPresent()) {
                ConsoleLog.info("Router", "User command (from " + msg.authorId() + " guildId=" + guildId + "): " + msg.content());
                return dispatch(pub.get(), msg, replier);
            }

            replier.send(ReplyPayload.text("Valid commands are: " + publicCommandList()
                    + ", use `" + Command.SIGIL + Command.HELP.token() + "` for more info."));
            return Outcome.UNKNOWN_COMMAND;
        }

        return handleSubmission(msg, replier);
    }

    private Outcome dispatch(CommandHandler handler, InboundMessage msg, Replier replier) throws Exception {
        CommandResult result = handler.handle(msg, msg.guildId());

        if (result instanceof CommandResult.Invalid invalid) {
            ConsoleLog.debug("Router", "Invalid command: " + invalid.reason() + " " + msg.describe());
            replier.send(ReplyPayload.mention(INVALID_ARGUMENT));
            return Outcome.INVALID_COMMAND;
        }
        if (result instanceof CommandResult.Reply reply) {
            replier.send(reply.payload());
            return Outcome.COMMAND;
        }
        throw new IllegalStateException("Unhandled command result: " + result);
    }

    // ----------------------------
    // Address submissions
    // ----------------------------

    private Outcome handleSubmission(InboundMessage msg, Replier replier) {
        GuildSettings s = store.settings(msg.guildId());
        if (!isEligible(s.whitelistChannel(), s.whitelistRole(), msg)) return Outcome.IGNORED;

        String address = msg.content();
        if (!validators.validate(s.ledgerType(), address)) {
            replier.send(ReplyPayload.text("The address `" + address + "` is invalid."));
            return Outcome.REJECTED;
        }

        // Re-check against the config as it is now; a >clear or reconfigure may have landed in between.
        Outcome outcome = store.mutateAndGet(msg.guildId(), cfg -> record(cfg, msg));

        switch (outcome) {
            case RECORDED -> {
                ConsoleLog.info("Router", "Recorded wallet guildId=" + msg.guildId() + " userId=" + msg.authorId());
                replier.send(ReplyPayload.mention("Your wallet `" + address + "` has been validated and recorded."));
            }
            case REJECTED -> replier.send(ReplyPayload.text("The address `" + address + "` is invalid."));
            default -> ConsoleLog.debug("Router", "Submission no longer eligible " + msg.describe());
        }
        return outcome;
    }

    private Outcome record(GuildConfig cfg, InboundMessage msg) {
        if (!isEligible(cfg.whitelistChannel, cfg.whitelistRole, msg)) return Outcome.IGNORED;
        if (!validators.validate(cfg.ledgerType, msg.content())) return Outcome.REJECTED;
        cfg.entries.put(msg.authorId(), msg.content());
        return Outcome.RECORDED;
    }

    private static boolean isEligible(Long channelId, Long roleId, InboundMessage msg) {
        return channelId != null
                && roleId != null
                && channelId == msg.channelId()
                && msg.hasRole(roleId);
    }

    private static String publicCommandList() {
        return Command.inScope(Command.Scope.PUBLIC).stream()
                .map(c -> "`" + c.token() + "`")
                .collect(Collectors.joining(", "));
    }
}
