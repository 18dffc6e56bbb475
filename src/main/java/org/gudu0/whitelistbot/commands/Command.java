package org.gudu0.whitelistbot.commands;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Every {@code >command} the bot understands.
 */
public enum Command {
    CHANNEL("channel", Scope.ADMIN, "`>channel #channelName`", "Sets the channel to listen for wallet addresses on."),
    ROLE("role", Scope.ADMIN, "`>role @roleName`", "Sets the role a user must possess to be able to add their address to the whitelist."),
    BLOCKCHAIN("blockchain", Scope.ADMIN, "`>blockchain eth/sol`", "Select which blockchain this drop will occur on, so added addresses can be validated."),
    CONFIG("config", Scope.ADMIN, "`>config`", "View the current server config."),
    DATA("data", Scope.ADMIN, "`>data`", "Get discordID:walletAddress pairs in a CSV file."),
    CLEAR("clear", Scope.ADMIN, "`>clear`", "Clear the config and data for this server."),
    HELP_ADMIN("help.admin", Scope.ADMIN, "`>help.admin`", "This screen."),
    HELP("help", Scope.PUBLIC, "`>help`", "How to use help screen."),
    CHECK("check", Scope.PUBLIC, "`>check`", "Tells you whether or not your wallet has been recorded in the whitelist.");

    public enum Scope { ADMIN, PUBLIC }

    public static final char SIGIL = '>';

    private final String token;
    private final Scope scope;
    private final String usage;
    private final String description;

    Command(String token, Scope scope, String usage, String description) {
        this.token = token;
        this.scope = scope;
        this.usage = usage;
        this.description = description;
    }

    public String token() { return token; }
    public Scope scope() { return scope; }
    public String usage() { return usage; }
    public String description() { return description; }

    public static Optional<Command> lookup(Scope scope, String token) {
        return Arrays.stream(values())
                .filter(c -> c.scope == scope && c.token.equals(token))
                .findFirst();
    }

    public static List<Command> inScope(Scope scope) {
        return Arrays.stream(values()).filter(c -> c.scope == scope).toList();
    }

    /**
     * First whitespace-delimited token without the sigil, e.g. {@code ">channel <#1>"} -> {@code "channel"}.
     * Empty if the text doesn't start with the sigil.
     */
    public static Optional<String> tokenOf(String content) {
        if (content == null || content.isEmpty() || content.charAt(0) != SIGIL) return Optional.empty();
        String first = content.split("\\s+", 2)[0];
        return Optional.of(first.substring(1));
    }
}
