package dora.beepex.archive.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import dora.beepex.archive.media.AttachmentHydrator;
import dora.beepex.archive.media.MediaArchiver;
import dora.beepex.archive.model.Attachment;
import dora.beepex.archive.model.Chat;
import dora.beepex.archive.model.ExportLayout;
import dora.beepex.archive.model.ExportPaths;
import dora.beepex.archive.model.ExportSettings;
import dora.beepex.archive.model.Message;
import dora.beepex.archive.render.ChatFileNames;
import dora.beepex.archive.render.ChatPageRenderer;
import dora.beepex.archive.render.GalleryPageRenderer;
import dora.beepex.archive.render.IndexEntry;
import dora.beepex.archive.render.IndexPageRenderer;
import dora.beepex.archive.source.ArchiveIntegrityException;
import dora.beepex.archive.source.CursorPager;
import dora.beepex.archive.source.MessageTimeline;
import dora.beepex.archive.source.RecordMapper;
import dora.beepex.archive.source.RemoteSource;
import dora.beepex.archive.thumb.ThumbnailGenerator;
import dora.beepex.shared.dto.ChatDto;
import dora.beepex.shared.dto.MessageDto;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs a whole export: lists the chats, exports the selected ones one after the
 * other and writes the index once every thumbnail is done.
 */
@Slf4j
public class ExportOrchestrator {

    private final RemoteSource source;
    private final ExportSettings settings;
    private final ExportLayout layout;
    private final ObjectMapper objectMapper;

    public ExportOrchestrator(RemoteSource source, ExportSettings settings, ObjectMapper objectMapper) {
        this.source = source;
        this.settings = settings;
        this.layout = new ExportLayout(settings);
        this.objectMapper = objectMapper;
    }

    public ExportOrchestrator(RemoteSource source, ExportSettings settings) {
        this(source, settings, new ObjectMapper());
    }

    public ExportSummary export(ChatFilter filter) throws InterruptedException {
        OffsetDateTime startedAt = OffsetDateTime.now(settings.getLocalZone());
        long started = System.nanoTime();
        log.info("Exporting to {}", layout.getRoot());

        List<ChatDto> listed = CursorPager.collect("chats", source::listChats);
        checkUniqueIds(listed);
        List<ChatDto> selected = filter.apply(listed);
        log.info("Selected {} of {} chat(s)", selected.size(), listed.size());

        AttachmentHydrator hydrator = new AttachmentHydrator(source, settings.getHydrationTimeout());
        ChatFileNames fileNames = new ChatFileNames();
        ChatPageRenderer chatPages = new ChatPageRenderer(layout, settings.getLocalZone());
        GalleryPageRenderer galleryPages = new GalleryPageRenderer(layout, objectMapper);
        List<IndexEntry> index = new ArrayList<>();
        ExportSummary.ExportSummaryBuilder summary = ExportSummary.builder().startedAt(startedAt);
        int messages = 0;
        int attachments = 0;
        int unresolved = 0;
        int galleryEntries = 0;

        try (ThumbnailGenerator thumbnails = new ThumbnailGenerator(settings)) {
            MediaArchiver archiver = new MediaArchiver(thumbnails);
            int position = 0;
            for (ChatDto listing : selected) {
                position++;
                Chat chat = fetchChat(listing);
                log.info("[{}/{}] {} ({} messages)", position, selected.size(), chat.getTitle(),
                        chat.getMessages().size());

                ExportPaths paths = layout.pathsFor(
                        ChatFileNames.accountDir(chat.getAccountId()), fileNames.allocate(chat));
                paths.recordHydrated(hydrator.hydrate(remoteRefs(chat)));
                archiver.archiveAll(chat, paths);

                chatPages.render(chat, paths);
                galleryEntries += galleryPages.render(chat, paths);
                stampModificationTime(chat, paths);

                index.add(new IndexEntry(chat.getAccountId(), chat.getNetwork(), chat.getTitle(), paths.getChatPage()));
                messages += chat.getMessages().size();
                attachments += paths.getArchived().size();
                unresolved += (int) paths.getArchived().values().stream().filter(Optional::isEmpty).count();
            }

            log.info("Waiting for {} thumbnail(s)", thumbnails.getSubmittedCount());
            thumbnails.awaitCompletion();
            summary.thumbnailsQueued(thumbnails.getSubmittedCount());
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        new IndexPageRenderer(layout).render(index, hostName(), startedAt, duration);
        log.info("Exported {} chat(s), {} message(s), {} attachment(s) ({} unavailable) in {}",
                index.size(), messages, attachments, unresolved, duration);

        return summary
                .chats(index.size())
                .messages(messages)
                .attachments(attachments)
                .unresolvedAttachments(unresolved)
                .galleryEntries(galleryEntries)
                .duration(duration)
                .build();
    }

    /** Retrieves the full chat and all of its messages, normalized and attached. */
    Chat fetchChat(ChatDto listing) {
        ChatDto detail = source.retrieveChat(listing.getId());
        Chat chat = RecordMapper.toChat(detail != null ? detail : listing);
        List<MessageDto> records = CursorPager.collect(
                "messages of " + chat.getId(), cursor -> source.listMessages(chat.getId(), cursor));

        List<Message> mapped = new ArrayList<>(records.size());
        for (MessageDto record : records) {
            RecordMapper.toMessage(record, chat).ifPresent(mapped::add);
        }
        chat.attachMessages(MessageTimeline.normalize(mapped));
        return chat;
    }

    static void checkUniqueIds(List<ChatDto> chats) {
        Set<String> ids = new HashSet<>();
        for (ChatDto chat : chats) {
            if (chat.getId() == null || chat.getId().isEmpty()) {
                throw new ArchiveIntegrityException("Chat listing contains a chat without id");
            }
            if (!ids.add(chat.getId())) {
                throw new ArchiveIntegrityException("Chat listing contains chat " + chat.getId() + " twice");
            }
        }
    }

    static Set<String> remoteRefs(Chat chat) {
        Set<String> refs = new LinkedHashSet<>();
        for (Message message : chat.getMessages()) {
            for (Attachment attachment : message.getAttachments()) {
                refs.add(attachment.getRemoteRef());
            }
        }
        return refs;
    }

    private static void stampModificationTime(Chat chat, ExportPaths paths) {
        List<Message> messages = chat.getMessages();
        if (messages.isEmpty()) {
            return;
        }
        OffsetDateTime last = messages.get(messages.size() - 1).getTimestamp();
        try {
            Files.setLastModifiedTime(paths.getChatPage(), FileTime.from(last.toInstant()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot set the modification time of " + paths.getChatPage(), e);
        }
    }

    static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Cannot resolve the local host name", e);
            return "localhost";
        }
    }
}
