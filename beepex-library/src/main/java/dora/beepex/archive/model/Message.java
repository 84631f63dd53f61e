package dora.beepex.archive.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;

@Value
@Builder
public class Message {
    @NonNull
    String id;

    @NonNull
    String chatId;

    @NonNull
    OffsetDateTime timestamp;

    /** Source-supplied ordering key, opaque but usually numeric. */
    @NonNull
    @Builder.Default
    String orderingKey = "";

    boolean fromSelf;

    @NonNull
    String senderId;

    @NonNull
    String senderDisplayName;

    /** {@code null} when the message carries no text; an empty string is still text. */
    String text;

    /** Id of the message this one replies to, if any. */
    String linkedMessageId;

    @Singular
    List<Attachment> attachments;

    @Singular
    List<Reaction> reactions;

    public boolean hasText() {
        return text != null;
    }

    /** A message with no text, no attachments and no reactions is left out of the export. */
    public boolean isBlank() {
        return text == null && attachments.isEmpty() && reactions.isEmpty();
    }
}
