package dora.beepex.archive.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dora.beepex.archive.model.Attachment;
import dora.beepex.archive.model.Chat;
import dora.beepex.archive.model.ExportLayout;
import dora.beepex.archive.model.ExportPaths;
import dora.beepex.archive.model.Message;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Renders the media gallery of one chat. The page itself is a static shell; the
 * media list is embedded as JSON and laid out by {@code gallery.js}.
 */
public class GalleryPageRenderer extends PageRenderer {

    private final ObjectMapper objectMapper;

    public GalleryPageRenderer(ExportLayout layout, ObjectMapper objectMapper) {
        super(layout);
        this.objectMapper = objectMapper;
    }

    /**
     * One entry per archived reference in message order: file name, message id,
     * and 1 when a thumbnail exists.
     */
    public static List<Object[]> mediaEntries(Chat chat, ExportPaths paths) {
        List<Object[]> entries = new ArrayList<>();
        Set<String> seenRefs = new HashSet<>();
        Set<String> seenFiles = new HashSet<>();
        for (Message message : chat.getMessages()) {
            for (Attachment attachment : message.getAttachments()) {
                String ref = attachment.getRemoteRef();
                if (!seenRefs.add(ref)) {
                    continue;
                }
                Optional<Path> archived = paths.archivedPath(ref);
                if (archived.isEmpty()) {
                    continue;
                }
                String fileName = archived.get().getFileName().toString();
                if (!seenFiles.add(fileName)) {
                    continue;
                }
                int hasThumbnail = paths.thumbnailPath(ref).isPresent() ? 1 : 0;
                entries.add(new Object[]{fileName, message.getId(), hasThumbnail});
            }
        }
        return entries;
    }

    public int render(Chat chat, ExportPaths paths) {
        Path page = paths.getGalleryPage();
        List<Object[]> entries = mediaEntries(chat, paths);

        StringBuilder html = new StringBuilder();
        openPage(html, page, "Media: " + chat.getTitle(), "water.css", "extra.css");
        html.append("<header>\n")
                .append("<h1>").append(HtmlText.escape(chat.getTitle())).append("</h1>\n")
                .append("<a class=\"chat-link\" href=\"").append(link(page, paths.getChatPage()))
                .append("\">&#x2190;&#xFE0E; Back to chat</a>\n")
                .append("</header>\n")
                .append("<main>\n")
                .append("<div class=\"gallery-search\">")
                .append("<input id=\"search-text\" type=\"search\" placeholder=\"Filter by file name\">")
                .append("<span id=\"search-count\"></span></div>\n")
                .append("<div id=\"gallery-grid\" class=\"gallery-grid\"></div>\n")
                .append("</main>\n")
                .append("<script>\n")
                .append("window.MEDIA = ").append(toScriptJson(entries)).append(";\n")
                .append("window.MEDIA_PREFIX = ").append(toScriptJson(RelativeLinks.href(page, paths.getMediaDir())))
                .append(";\n")
                .append("window.THUMB_PREFIX = ")
                .append(toScriptJson(RelativeLinks.href(page, paths.getThumbnailDir()))).append(";\n")
                .append("window.CHAT_FILE_URL = ").append(toScriptJson(RelativeLinks.href(page, paths.getChatPage())))
                .append(";\n")
                .append("</script>\n")
                .append("<script src=\"").append(resource(page, "gallery.js")).append("\"></script>\n");
        closePage(html);
        write(page, html);
        return entries.size();
    }

    /** JSON that can sit inside a script element: no {@code </} sequence survives. */
    String toScriptJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize gallery data", e);
        }
    }
}
