package org.gudu0.whitelistbot.router;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.utils.FileUpload;
import org.gudu0.whitelistbot.util.ConsoleLog;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sends {@link ReplyPayload}s as replies to one JDA message.
 */
public class MessageReplies implements Replier {

    private static final int EMBED_COLOR = 0x2ecc71;

    private final Message message;

    public MessageReplies(Message message) {
        this.message = message;
    }

    @Override
    public void send(ReplyPayload payload) {
        if (payload instanceof ReplyPayload.Text t) {
            message.reply(t.text())
                    .mentionRepliedUser(t.mentionAuthor())
                    .queue(ok -> { }, this::logFailure);
        } else if (payload instanceof ReplyPayload.Embed e) {
            EmbedBuilder eb = new EmbedBuilder()
                    .setTitle(e.title())
                    .setDescription(e.description())
                    .setColor(EMBED_COLOR);
            for (ReplyPayload.Field f : e.fields()) {
                eb.addField(f.name(), f.value(), f.inline());
            }
            message.replyEmbeds(eb.build())
                    .mentionRepliedUser(e.mentionAuthor())
                    .queue(ok -> { }, this::logFailure);
        } else if (payload instanceof ReplyPayload.Attachment a) {
            Path file = a.file();
            message.reply(a.text())
                    .addFiles(FileUpload.fromData(file.toFile(), a.fileName()))
                    .mentionRepliedUser(a.mentionAuthor())
                    .queue(
                            ok -> deleteStaged(file),
                            err -> {
                                logFailure(err);
                                deleteStaged(file);
                            });
        } else {
            throw new IllegalArgumentException("Unsupported reply payload: " + payload);
        }
    }

    private void logFailure(Throwable err) {
        ConsoleLog.error("Reply", "Reply to messageId=" + message.getId() + " failed: " + err.getMessage(), err);
    }

    private static void deleteStaged(Path file) {
        try {
            Files.deleteIfExists(file);
            ConsoleLog.debug("Reply", "Removed staged file " + file);
        } catch (Exception e) {
            ConsoleLog.error("Reply", "Failed removing staged file " + file + ": " + e.getMessage(), e);
        }
    }
}
