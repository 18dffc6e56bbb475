package org.gudu0.whitelistbot.commands;

import org.gudu0.whitelistbot.export.CsvExporter;
import org.gudu0.whitelistbot.guild.GuildStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CommandTableTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("every command has a handler")
    void everyCommandMapped() {
        CommandTable table = table();
        for (Command c : Command.values()) {
            assertThat(table.handler(c)).as(c.name()).isNotNull();
        }
    }

    @Test
    @DisplayName("lookup respects the admin/public split")
    void lookupByScope() {
        CommandTable table = table();

        assertThat(table.find(Command.Scope.ADMIN, "channel")).isPresent();
        assertThat(table.find(Command.Scope.PUBLIC, "channel")).isEmpty();
        assertThat(table.find(Command.Scope.PUBLIC, "check")).isPresent();
        assertThat(table.find(Command.Scope.ADMIN, "check")).isEmpty();
        assertThat(table.find(Command.Scope.ADMIN, "help.admin")).isPresent();
        assertThat(table.find(Command.Scope.PUBLIC, "nope")).isEmpty();
    }

    @Test
    @DisplayName("token is the first word without the sigil")
    void tokenOf() {
        assertThat(Command.tokenOf(">channel <#1>")).contains("channel");
        assertThat(Command.tokenOf(">help.admin")).contains("help.admin");
        assertThat(Command.tokenOf(">")).contains("");
        assertThat(Command.tokenOf("channel")).isEmpty();
        assertThat(Command.tokenOf(" >channel")).isEmpty();
        assertThat(Command.tokenOf("")).isEmpty();
    }

    private CommandTable table() {
        GuildStore store = new GuildStore(dir.resolve("whitelist.json"));
        return CommandTable.of(new WhitelistCommands(store, new CsvExporter(dir.resolve("exports"))));
    }
}
