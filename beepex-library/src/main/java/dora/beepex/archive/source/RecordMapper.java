package dora.beepex.archive.source;

import dora.beepex.archive.model.Attachment;
import dora.beepex.archive.model.AttachmentKind;
import dora.beepex.archive.model.Chat;
import dora.beepex.archive.model.Message;
import dora.beepex.archive.model.Reaction;
import dora.beepex.archive.model.User;
import dora.beepex.shared.dto.AttachmentDto;
import dora.beepex.shared.dto.AttachmentSizeDto;
import dora.beepex.shared.dto.ChatDto;
import dora.beepex.shared.dto.MessageDto;
import dora.beepex.shared.dto.ReactionDto;
import dora.beepex.shared.dto.UserDto;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Turns the loosely structured payloads of the service into model objects.
 * <p>
 * Records the export cannot place (no id, no timestamp) are dropped with a
 * warning; records that contradict the chat being exported abort the export.
 */
@Slf4j
public final class RecordMapper {

    static final String UNKNOWN = "unknown";
    static final String DEFAULT_FILE_NAME = "attachment";

    private RecordMapper() {
    }

    public static Chat toChat(ChatDto dto) {
        if (isMissing(dto.getId())) {
            throw new ArchiveIntegrityException("Chat without id: " + dto);
        }
        List<User> participants = new ArrayList<>();
        if (dto.getParticipants() != null && dto.getParticipants().getItems() != null) {
            for (UserDto userDto : dto.getParticipants().getItems()) {
                toUser(userDto).ifPresentOrElse(participants::add,
                        () -> log.warn("Dropping participant without id in chat {}", dto.getId()));
            }
        }
        return new Chat(
                dto.getId(),
                orDefault(dto.getAccountId(), UNKNOWN),
                orDefault(dto.getNetwork(), UNKNOWN),
                orDefault(dto.getTitle(), dto.getId()),
                participants);
    }

    public static Optional<User> toUser(UserDto dto) {
        if (dto == null || isMissing(dto.getId())) {
            return Optional.empty();
        }
        return Optional.of(User.builder()
                .id(dto.getId())
                .displayName(displayName(dto))
                .self(Boolean.TRUE.equals(dto.getIsSelf()))
                .build());
    }

    /** Full name, then username, email, phone number and finally the id. */
    static String displayName(UserDto dto) {
        return Stream.of(dto.getFullName(), dto.getUsername(), dto.getEmail(), dto.getPhoneNumber())
                .filter(value -> !isMissing(value))
                .findFirst()
                .orElse(dto.getId());
    }

    /**
     * Maps one message record of {@code chat}. Returns empty for records that have
     * to be skipped; throws {@link ArchiveIntegrityException} for a record that
     * belongs to another chat.
     */
    public static Optional<Message> toMessage(MessageDto dto, Chat chat) {
        if (dto.getChatId() != null && !dto.getChatId().equals(chat.getId())) {
            throw new ArchiveIntegrityException("Message " + dto.getId() + " of unknown chat "
                    + dto.getChatId() + " returned for chat " + chat.getId());
        }
        if (isMissing(dto.getId())) {
            log.warn("Dropping message without id in chat {}", chat.getId());
            return Optional.empty();
        }
        OffsetDateTime timestamp = parseTimestamp(dto.getTimestamp());
        if (timestamp == null) {
            log.warn("Dropping message {} with unreadable timestamp '{}'", dto.getId(), dto.getTimestamp());
            return Optional.empty();
        }

        String senderId = orDefault(dto.getSenderId(), UNKNOWN);
        String senderName = !isMissing(dto.getSenderName()) ? dto.getSenderName() : chat.displayNameOf(senderId);

        Message.MessageBuilder builder = Message.builder()
                .id(dto.getId())
                .chatId(chat.getId())
                .timestamp(timestamp)
                .orderingKey(dto.getSortKey() != null ? dto.getSortKey() : "")
                .fromSelf(Boolean.TRUE.equals(dto.getIsSender()))
                .senderId(senderId)
                .senderDisplayName(senderName)
                .text(dto.getText())
                .linkedMessageId(isMissing(dto.getLinkedMessageId()) ? null : dto.getLinkedMessageId());

        if (dto.getAttachments() != null) {
            for (AttachmentDto attachmentDto : dto.getAttachments()) {
                Optional<Attachment> attachment = toAttachment(attachmentDto);
                if (attachment.isPresent()) {
                    builder.attachment(attachment.get());
                } else {
                    log.warn("Dropping attachment without source of message {}", dto.getId());
                }
            }
        }
        if (dto.getReactions() != null) {
            for (ReactionDto reactionDto : dto.getReactions()) {
                if (reactionDto == null || isMissing(reactionDto.getParticipantId())
                        || isMissing(reactionDto.getReactionKey())) {
                    log.debug("Dropping incomplete reaction on message {}", dto.getId());
                    continue;
                }
                builder.reaction(Reaction.builder()
                        .id(reactionDto.getId())
                        .reactingUserId(reactionDto.getParticipantId())
                        .key(reactionDto.getReactionKey())
                        .build());
            }
        }
        return Optional.of(builder.build());
    }

    public static Optional<Attachment> toAttachment(AttachmentDto dto) {
        if (dto == null || isMissing(dto.getSrcUrl())) {
            return Optional.empty();
        }
        Attachment.AttachmentBuilder builder = Attachment.builder()
                .kind(AttachmentKind.fromWireType(dto.getType()))
                .remoteRef(dto.getSrcUrl())
                .fileName(fileName(dto));
        AttachmentSizeDto size = dto.getSize();
        if (size != null) {
            builder.width(size.getWidth()).height(size.getHeight());
        }
        return Optional.of(builder.build());
    }

    static String fileName(AttachmentDto dto) {
        if (!isMissing(dto.getFileName())) {
            return dto.getFileName();
        }
        String url = dto.getSrcUrl();
        int query = url.indexOf('?');
        if (query >= 0) {
            url = url.substring(0, query);
        }
        String lastSegment = url.substring(url.lastIndexOf('/') + 1);
        return lastSegment.isBlank() ? DEFAULT_FILE_NAME : lastSegment;
    }

    static OffsetDateTime parseTimestamp(String value) {
        if (isMissing(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static boolean isMissing(String value) {
        return value == null || value.isBlank();
    }

    private static String orDefault(String value, String fallback) {
        return isMissing(value) ? fallback : value;
    }
}
