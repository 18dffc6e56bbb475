package org.gudu0.whitelistbot.commands;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed command -> handler mapping, built once at startup.
 */
public final class CommandTable {

    private final Map<Command, CommandHandler> handlers;

    private CommandTable(Map<Command, CommandHandler> handlers) {
        this.handlers = Collections.unmodifiableMap(handlers);
    }

    public static CommandTable of(WhitelistCommands commands) {
        EnumMap<Command, CommandHandler> map = new EnumMap<>(Command.class);
        for (Command c : Command.values()) {
            CommandHandler h = switch (c) {
                case CHANNEL -> commands::setChannel;
                case ROLE -> commands::setRole;
                case BLOCKCHAIN -> commands::setBlockchain;
                case CONFIG -> commands::showConfig;
                case DATA -> commands::exportData;
                case CLEAR -> commands::clear;
                case HELP_ADMIN -> commands::helpAdmin;
                case HELP -> commands::help;
                case CHECK -> commands::check;
            };
            map.put(c, h);
        }
        return new CommandTable(map);
    }

    /** Handler for {@code token} among the commands of {@code scope}. */
    public Optional<CommandHandler> find(Command.Scope scope, String token) {
        return Command.lookup(scope, token).map(this::handler);
    }

    public CommandHandler handler(Command command) {
        return handlers.get(command);
    }
}
