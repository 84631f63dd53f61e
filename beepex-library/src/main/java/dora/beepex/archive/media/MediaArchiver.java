package dora.beepex.archive.media;

import dora.beepex.archive.model.Attachment;
import dora.beepex.archive.model.AttachmentKind;
import dora.beepex.archive.model.Chat;
import dora.beepex.archive.model.ExportPaths;
import dora.beepex.archive.model.Message;
import dora.beepex.archive.thumb.ImageSize;
import dora.beepex.archive.thumb.ThumbnailGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Copies hydrated attachments into the chat's media directory under names derived
 * from the message time and the original file name, so that repeated exports
 * produce the same files and skip the ones already present.
 */
@Slf4j
@RequiredArgsConstructor
public class MediaArchiver {

    private static final DateTimeFormatter NAME_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss").withZone(ZoneOffset.UTC);

    private final ThumbnailGenerator thumbnails;

    public void archiveAll(Chat chat, ExportPaths paths) {
        for (Message message : chat.getMessages()) {
            for (Attachment attachment : message.getAttachments()) {
                archive(message, attachment, paths);
            }
        }
    }

    /**
     * Archives one attachment unless its reference was handled earlier in this
     * chat. Records the archived path (or the unresolved marker) and, for large
     * images, the planned thumbnail.
     */
    public Optional<Path> archive(Message message, Attachment attachment, ExportPaths paths) {
        String ref = attachment.getRemoteRef();
        if (paths.isArchived(ref)) {
            return paths.archivedPath(ref);
        }
        Optional<Path> source = paths.hydratedPath(ref);
        if (source.isEmpty()) {
            paths.recordArchived(ref, Optional.empty());
            return Optional.empty();
        }

        Path target = paths.getMediaDir().resolve(archivedName(message, attachment));
        try {
            if (Files.exists(target)) {
                log.debug("{} already archived", target);
            } else {
                AtomicFiles.copy(source.get(), target);
                Files.setLastModifiedTime(target, FileTime.from(message.getTimestamp().toInstant()));
            }
        } catch (IOException e) {
            if (!Files.isReadable(source.get())) {
                log.warn("Attachment {} of message {} cannot be read: {}", ref, message.getId(), e.getMessage());
                paths.recordArchived(ref, Optional.empty());
                return Optional.empty();
            }
            throw new UncheckedIOException("Cannot archive " + source.get() + " to " + target, e);
        }
        paths.recordArchived(ref, Optional.of(target));

        if (attachment.getKind() == AttachmentKind.IMAGE) {
            ImageSize knownSize = attachment.hasDimensions()
                    ? new ImageSize(attachment.getWidth(), attachment.getHeight())
                    : null;
            thumbnails.planThumbnail(target, paths.getThumbnailDir(), knownSize)
                    .ifPresent(thumbnail -> paths.recordThumbnail(ref, thumbnail));
        }
        return Optional.of(target);
    }

    /** {@code <UTC send time>_<original stem><extension>}, sanitized. */
    public static String archivedName(Message message, Attachment attachment) {
        String fileName = attachment.getFileName();
        String stem = NAME_TIMESTAMP.format(message.getTimestamp()) + "_" + FileNames.stem(fileName);
        return FileNames.sanitize(stem) + FileNames.stripReservedCharacters(FileNames.extension(fileName));
    }
}
