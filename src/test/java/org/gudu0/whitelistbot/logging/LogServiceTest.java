package org.gudu0.whitelistbot.logging;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class LogServiceTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("events are appended as head/text records")
    void appendsEvents() throws Exception {
        LogService logs = new LogService(dir.resolve("logs").resolve("bot.log"));

        logs.event("New Guild", "1, First");
        logs.event("New Guild", "2, Second");

        String text = Files.readString(logs.file());
        assertThat(text).containsPattern("\\[[^]]+] Head: New Guild\n   Text: 1, First\n\n");
        assertThat(text.indexOf("1, First")).isLessThan(text.indexOf("2, Second"));
    }

    @Test
    @DisplayName("fault head is the stack trace on a single line")
    void faultFlattensStackTrace() throws Exception {
        LogService logs = new LogService(dir.resolve("bot.log"));

        logs.fault(new IllegalStateException("boom"), "while doing a thing");

        String first = Files.readAllLines(logs.file()).get(0);
        assertThat(first).contains("Head: java.lang.IllegalStateException: boom---")
                .contains("LogServiceTest");
        assertThat(Files.readString(logs.file())).contains("   Text: while doing a thing");
    }

    @Test
    @DisplayName("flatten keeps causes")
    void flattenIncludesCause() {
        String flat = LogService.flatten(new RuntimeException("outer", new IllegalArgumentException("inner")));

        assertThat(flat).doesNotContain("\n").contains("outer").contains("Caused by: java.lang.IllegalArgumentException: inner");
    }

    @Test
    @DisplayName("unwritable log file does not throw")
    void unwritableFileIsTolerated() throws Exception {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "x");

        new LogService(blocker.resolve("bot.log")).event("Head", "body");
    }
}
