package dora.beepex.archive.export;

import dora.beepex.archive.model.ExportSettings;
import dora.beepex.archive.source.ArchiveIntegrityException;
import dora.beepex.shared.dto.AttachmentDto;
import dora.beepex.shared.dto.AttachmentSizeDto;
import dora.beepex.shared.dto.ChatDto;
import dora.beepex.shared.dto.MessageDto;
import dora.beepex.shared.dto.ParticipantsDto;
import dora.beepex.shared.dto.ReactionDto;
import dora.beepex.shared.dto.UserDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static dora.beepex.archive.Fixtures.writePng;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportOrchestratorTest {

    @TempDir
    Path tempDir;

    private Path out;
    private ExportSettings settings;
    private FakeRemoteSource source;

    private static ChatDto chat(String id, String accountId, String title) {
        return ChatDto.builder()
                .id(id)
                .accountId(accountId)
                .network("WhatsApp")
                .title(title)
                .participants(ParticipantsDto.builder().items(List.of(
                        UserDto.builder().id("me").fullName("Dora").isSelf(true).build(),
                        UserDto.builder().id("ann").fullName("Ann").build())).build())
                .build();
    }

    private static MessageDto.MessageDtoBuilder message(String chatId, String id, String senderId, String timestamp) {
        return MessageDto.builder().id(id).chatId(chatId).senderId(senderId).timestamp(timestamp)
                .isSender("me".equals(senderId));
    }

    @BeforeEach
    void setUp() throws Exception {
        out = tempDir.resolve("out");
        settings = ExportSettings.builder().outputRoot(out).localZone(ZoneOffset.UTC).build();
        Path photo = writePng(tempDir.resolve("cache/photo.png"), 1000, 800);

        source = new FakeRemoteSource()
                .asset("mxc://beeper.com/photo", photo)
                .chat(chat("c1", "acct-1", "Bob"),
                        message("c1", "m1", "ann", "2024-03-01T12:00:00Z")
                                .attachments(List.of(AttachmentDto.builder()
                                        .type("img")
                                        .srcUrl("mxc://beeper.com/photo")
                                        .fileName("photo.png")
                                        .size(AttachmentSizeDto.builder().width(1000).height(800).build())
                                        .build()))
                                .build(),
                        message("c1", "m2", "ann", "2024-03-01T12:01:00Z").build(),
                        message("c1", "m3", "me", "2024-03-01T12:02:00Z")
                                .reactions(List.of(ReactionDto.builder()
                                        .id("r1").participantId("ann").reactionKey("👍").build()))
                                .build());
    }

    @Test
    void exportsChatGalleryThumbnailAndIndex() throws Exception {
        ExportSummary summary = new ExportOrchestrator(source, settings).export(ChatFilter.all());

        assertThat(summary.getChats()).isEqualTo(1);
        assertThat(summary.getMessages()).isEqualTo(2);
        assertThat(summary.getThumbnailsQueued()).isEqualTo(1);
        assertThat(summary.getGalleryEntries()).isEqualTo(1);
        assertThat(summary.getUnresolvedAttachments()).isZero();

        Path chatPage = out.resolve("chat/acct-1/Bob.html");
        String chatHtml = Files.readString(chatPage);
        assertThat(chatHtml.split("<section class=\"msg ", -1)).hasSize(3);
        assertThat(chatHtml)
                .contains("<h1>Bob</h1>")
                .contains("id=\"m1\"")
                .contains("href=\"../../media/full/acct-1/Bob/2024-03-01_12-00-00_photo.png\"")
                .contains("src=\"../../media/thumb/acct-1/Bob/2024-03-01_12-00-00_photo.jpg\"")
                .contains("href=\"../../gallery/acct-1/Bob.html\"")
                .contains("href=\"../../media/beepex/water.css\"")
                .contains("title=\"Ann\">👍 1</span>")
                .doesNotContain("id=\"m2\"");
        assertThat(Files.getLastModifiedTime(chatPage).toInstant())
                .isEqualTo(Instant.parse("2024-03-01T12:02:00Z"));

        try (Stream<Path> thumbnails = Files.list(out.resolve("media/thumb/acct-1/Bob"))) {
            assertThat(thumbnails).hasSize(1);
        }

        String galleryHtml = Files.readString(out.resolve("gallery/acct-1/Bob.html"));
        assertThat(galleryHtml)
                .contains("window.MEDIA = [[\"2024-03-01_12-00-00_photo.png\",\"m1\",1]];")
                .contains("window.MEDIA_PREFIX = \"../../media/full/acct-1/Bob\";")
                .contains("window.THUMB_PREFIX = \"../../media/thumb/acct-1/Bob\";")
                .contains("window.CHAT_FILE_URL = \"../../chat/acct-1/Bob.html\";")
                .contains("src=\"../../media/beepex/gallery.js\"");

        String indexHtml = Files.readString(out.resolve("index.html"));
        assertThat(indexHtml)
                .contains("<li>WhatsApp (acct-1)")
                .contains("<li><a href=\"chat/acct-1/Bob.html\">Bob</a></li>")
                .contains("1 chat</div>");
        assertThat(indexHtml.split("<a href=", -1)).hasSize(2);
    }

    @Test
    void secondRunRewritesIdenticalPagesAndMedia() throws Exception {
        new ExportOrchestrator(source, settings).export(ChatFilter.all());
        byte[] chatPage = Files.readAllBytes(out.resolve("chat/acct-1/Bob.html"));
        byte[] thumbnail = Files.readAllBytes(out.resolve("media/thumb/acct-1/Bob/2024-03-01_12-00-00_photo.jpg"));

        ExportSummary second = new ExportOrchestrator(source, settings).export(ChatFilter.all());

        assertThat(second.getThumbnailsQueued()).isZero();
        assertThat(out.resolve("chat/acct-1/Bob.html")).hasBinaryContent(chatPage);
        assertThat(out.resolve("media/thumb/acct-1/Bob/2024-03-01_12-00-00_photo.jpg")).hasBinaryContent(thumbnail);
    }

    @Test
    void unresolvedAttachmentRendersPlaceholder() throws Exception {
        source.chat(chat("c2", "acct-1", "Carol"),
                message("c2", "x1", "ann", "2024-03-02T08:00:00Z")
                        .attachments(List.of(AttachmentDto.builder().type("video").srcUrl("mxc://beeper.com/gone")
                                .fileName("clip.mp4").build()))
                        .build());

        ExportSummary summary = new ExportOrchestrator(source, settings)
                .export(ChatFilter.parse(List.of("--include-chat=c2")));

        assertThat(summary.getChats()).isEqualTo(1);
        assertThat(summary.getUnresolvedAttachments()).isEqualTo(1);
        assertThat(Files.readString(out.resolve("chat/acct-1/Carol.html")))
                .contains("Attachment not available: clip.mp4");
        assertThat(Files.readString(out.resolve("gallery/acct-1/Carol.html"))).contains("window.MEDIA = [];");
        assertThat(out.resolve("chat/acct-1/Bob.html")).doesNotExist();
    }

    @Test
    void messageOfAnotherChatAbortsExport() {
        source.chat(chat("c2", "acct-1", "Carol"), message("c1", "x1", "ann", "2024-03-02T08:00:00Z").text("hi").build());

        assertThatThrownBy(() -> new ExportOrchestrator(source, settings)
                .export(ChatFilter.parse(List.of("--include-chat=c2"))))
                .isInstanceOf(ArchiveIntegrityException.class);
    }

    @Test
    void duplicateChatIdsAreRejected() {
        assertThatThrownBy(() -> ExportOrchestrator.checkUniqueIds(List.of(
                ChatDto.builder().id("c1").build(),
                ChatDto.builder().id("c2").build(),
                ChatDto.builder().id("c1").build())))
                .isInstanceOf(ArchiveIntegrityException.class)
                .hasMessageContaining("c1");
    }
}
