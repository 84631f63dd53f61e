package dora.beepex.archive.render;

import com.google.common.net.UrlEscapers;
import dora.beepex.archive.model.Attachment;
import dora.beepex.archive.model.Chat;
import dora.beepex.archive.model.ExportLayout;
import dora.beepex.archive.model.ExportPaths;
import dora.beepex.archive.model.Message;
import dora.beepex.archive.model.Reaction;
import dora.beepex.archive.model.User;

import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders the page of one chat: a header with the chat details and every message
 * in order, with its media inline and its reactions.
 */
public class ChatPageRenderer extends PageRenderer {

    private static final DateTimeFormatter LOCAL_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss zzz", Locale.ENGLISH);
    private static final DateTimeFormatter UTC_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private final ZoneId localZone;

    public ChatPageRenderer(ExportLayout layout, ZoneId localZone) {
        super(layout);
        this.localZone = localZone;
    }

    public void render(Chat chat, ExportPaths paths) {
        Path page = paths.getChatPage();
        StringBuilder html = new StringBuilder();
        openPage(html, page, "Chat: " + chat.getTitle(), "water.css", "extra.css");

        html.append("<header>\n");
        renderHeader(html, chat, paths);
        html.append("</header>\n");

        html.append("<main>\n");
        for (Message message : chat.getMessages()) {
            renderMessage(html, chat, message, paths);
        }
        html.append("</main>\n");

        closePage(html);
        write(page, html);
    }

    private void renderHeader(StringBuilder html, Chat chat, ExportPaths paths) {
        html.append("<section class=\"chat-header\">\n")
                .append("<h1>").append(HtmlText.escape(chat.getTitle())).append("</h1>\n")
                .append("<a class=\"gallery-link\" href=\"")
                .append(link(paths.getChatPage(), paths.getGalleryPage()))
                .append("\">Media gallery</a>\n")
                .append("<details>\n");
        detail(html, "Network", chat.getNetwork());
        detail(html, "Account ID", chat.getAccountId());
        detail(html, "Chat ID", chat.getId());
        detail(html, "Messages", String.valueOf(chat.getMessages().size()));
        html.append("<div><span class=\"chat-details-label\">Participants:</span></div>\n");
        chat.getParticipants().stream()
                .map(User::getDisplayName)
                .sorted(String.CASE_INSENSITIVE_ORDER)
                .forEach(name -> html.append("<div>").append(HtmlText.escape(name)).append("</div>\n"));
        html.append("</details>\n")
                .append("</section>\n");
    }

    private static void detail(StringBuilder html, String label, String value) {
        html.append("<div><span class=\"chat-details-label\">").append(label).append(": </span><span>")
                .append(HtmlText.escape(value)).append("</span></div>\n");
    }

    private void renderMessage(StringBuilder html, Chat chat, Message message, ExportPaths paths) {
        String id = HtmlText.escape(message.getId());
        String anchor = anchorHref(message.getId());
        html.append("<section class=\"msg ").append(message.isFromSelf() ? "msg-self" : "msg-other").append("\">")
                .append("<div id=\"").append(id).append("\" class=\"msg-header\">")
                .append("<span class=\"msg-contact-name\">").append(HtmlText.escape(message.getSenderDisplayName()))
                .append("</span>")
                .append("<span class=\"msg-datetime\" title=\"").append(UTC_TIME.format(message.getTimestamp()))
                .append("\">").append(LOCAL_TIME.format(message.getTimestamp().atZoneSameInstant(localZone)))
                .append("</span>")
                .append("<a class=\"permalink\" title=\"Message ").append(id).append("\" href=\"").append(anchor)
                .append("\">&#x1F517;&#xFE0E;</a></div>\n");

        if (message.getLinkedMessageId() != null) {
            html.append("<div class=\"msg-reply\"><a href=\"").append(anchorHref(message.getLinkedMessageId()))
                    .append("\">&#x21A9;&#xFE0E; In reply to a message</a></div>\n");
        }
        if (message.hasText()) {
            html.append("<div class=\"msg-text\">").append(HtmlText.format(message.getText())).append("</div>\n");
        }
        for (Attachment attachment : message.getAttachments()) {
            renderAttachment(html, attachment, paths);
        }
        renderReactions(html, chat, message.getReactions());
        html.append("</section>\n");
    }

    private void renderAttachment(StringBuilder html, Attachment attachment, ExportPaths paths) {
        Optional<Path> archived = paths.archivedPath(attachment.getRemoteRef());
        if (archived.isEmpty()) {
            html.append("<div class=\"msg-attachment-missing\">&#x26A0;&#xFE0E; Attachment not available: ")
                    .append(HtmlText.escape(attachment.getFileName())).append("</div>\n");
            return;
        }
        Path page = paths.getChatPage();
        String url = link(page, archived.get());
        switch (attachment.getKind()) {
            case IMAGE:
                Optional<Path> thumbnail = paths.thumbnailPath(attachment.getRemoteRef());
                String src = thumbnail.map(path -> link(page, path)).orElse(url);
                String dimensions = thumbnail.isEmpty() && attachment.hasDimensions()
                        ? " width=\"" + attachment.getWidth() + "\" height=\"" + attachment.getHeight() + "\""
                        : "";
                html.append("<a href=\"").append(url).append("\"><img loading=\"lazy\"").append(dimensions)
                        .append(" src=\"").append(src).append("\" alt=\"")
                        .append(HtmlText.escape(attachment.getFileName())).append("\"></a>\n");
                break;
            case VIDEO:
                html.append("<video controls loop playsinline preload=\"metadata\" src=\"").append(url)
                        .append("\"></video>\n");
                break;
            case AUDIO:
                html.append("<audio controls preload=\"metadata\" src=\"").append(url).append("\"></audio>\n");
                break;
            default:
                html.append("<div class=\"msg-attachment\"><a download href=\"").append(url).append("\">")
                        .append(HtmlText.escape(attachment.getFileName())).append("</a></div>\n");
                break;
        }
    }

    private static void renderReactions(StringBuilder html, Chat chat, List<Reaction> reactions) {
        if (reactions.isEmpty()) {
            return;
        }
        Map<String, List<String>> byKey = new LinkedHashMap<>();
        for (Reaction reaction : reactions) {
            byKey.computeIfAbsent(reaction.getKey(), key -> new ArrayList<>())
                    .add(chat.displayNameOf(reaction.getReactingUserId()));
        }
        html.append("<div class=\"msg-reactions\">");
        byKey.forEach((key, names) -> {
            String who = names.stream().sorted(String.CASE_INSENSITIVE_ORDER).collect(Collectors.joining(", "));
            html.append("<span class=\"reaction\" title=\"").append(HtmlText.escape(who)).append("\">")
                    .append(HtmlText.escape(key)).append(" ").append(names.size()).append("</span>");
        });
        html.append("</div>\n");
    }

    static String anchorHref(String messageId) {
        return HtmlText.escape("#" + UrlEscapers.urlFragmentEscaper().escape(messageId));
    }
}
