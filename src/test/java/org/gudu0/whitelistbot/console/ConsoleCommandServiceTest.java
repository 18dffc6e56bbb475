package org.gudu0.whitelistbot.console;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import org.gudu0.whitelistbot.guild.GuildStore;
import org.gudu0.whitelistbot.ledger.LedgerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsoleCommandServiceTest {

    @TempDir
    Path dir;

    @Mock
    JDA jda;
    @Mock
    Guild guild;

    @Test
    @DisplayName("save writes the snapshot")
    void saveWritesSnapshot() throws Exception {
        GuildStore store = new GuildStore(dir.resolve("whitelist.json"));
        store.ensure(5L);
        ConsoleCommandService console = new ConsoleCommandService(store, jda, System.in);

        console.handle("save");

        assertThat(store.snapshotPath()).exists();
        assertThat(Files.readString(store.snapshotPath())).contains("\"5\"");
    }

    @Test
    @DisplayName("guild status reads the stored settings")
    void guildStatus() {
        GuildStore store = new GuildStore(dir.resolve("whitelist.json"));
        store.mutate(5L, cfg -> cfg.ledgerType = LedgerType.SOL);
        when(guild.getName()).thenReturn("Five");
        when(jda.getGuildById(5L)).thenReturn(guild);
        when(jda.getGuildById(6L)).thenReturn(null);
        ConsoleCommandService console = new ConsoleCommandService(store, jda, System.in);

        console.handle("guild 5 status");
        console.handle("guild 6");
        console.handle("guild abc");

        verify(jda).getGuildById(5L);
        verify(jda).getGuildById(6L);
        assertThat(store.guildIds()).containsExactly(5L);
    }

    @Test
    @DisplayName("loop reads lines until stdin closes")
    void loopStopsAtEndOfInput() {
        GuildStore store = new GuildStore(dir.resolve("whitelist.json"));
        when(jda.getGuilds()).thenReturn(List.of());
        byte[] input = "help\n\nguilds\nbogus\n".getBytes(StandardCharsets.UTF_8);

        new ConsoleCommandService(store, jda, new ByteArrayInputStream(input)).runLoop();

        verify(jda).getGuilds();
        verify(jda, never()).shutdown();
    }
}
