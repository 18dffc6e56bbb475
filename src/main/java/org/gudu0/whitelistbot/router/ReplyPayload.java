package org.gudu0.whitelistbot.router;

import java.nio.file.Path;
import java.util.List;

/**
 * A reply to the message that triggered it.
 */
public interface ReplyPayload {

    /** Whether the reply pings the author of the original message. */
    boolean mentionAuthor();

    record Text(String text, boolean mentionAuthor) implements ReplyPayload {}

    record Embed(String title, String description, List<Field> fields, boolean mentionAuthor) implements ReplyPayload {
        public Embed {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }

    record Field(String name, String value, boolean inline) {}

    /**
     * Text with a file, uploaded as {@code fileName}. The file is a staged copy: whoever sends it deletes it afterwards.
     */
    record Attachment(String text, Path file, String fileName, boolean mentionAuthor) implements ReplyPayload {}

    static Text text(String text) {
        return new Text(text, false);
    }

    static Text mention(String text) {
        return new Text(text, true);
    }
}
