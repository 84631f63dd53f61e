package dora.beepex.archive.export;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.OffsetDateTime;

@Value
@Builder
public class ExportSummary {
    int chats;
    int messages;
    int attachments;
    int unresolvedAttachments;
    int thumbnailsQueued;
    int galleryEntries;
    OffsetDateTime startedAt;
    Duration duration;
}
