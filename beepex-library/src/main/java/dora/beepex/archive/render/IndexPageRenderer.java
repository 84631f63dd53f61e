package dora.beepex.archive.render;

import dora.beepex.archive.model.ExportLayout;

import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the root page listing every exported chat, grouped by account.
 */
public class IndexPageRenderer extends PageRenderer {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    public IndexPageRenderer(ExportLayout layout) {
        super(layout);
    }

    public void render(List<IndexEntry> entries, String hostName, OffsetDateTime startedAt, Duration duration) {
        Path page = layout.indexPage();
        StringBuilder html = new StringBuilder();
        openPage(html, page, "Beeper Chats", "water.css");
        html.append("<h1>Beeper Chats</h1>\n")
                .append("<div class=\"export-info\">Exported from <span class=\"host\">")
                .append(HtmlText.escape(hostName)).append("</span> on ").append(DATE.format(startedAt))
                .append(" at ").append(TIME.format(startedAt))
                .append(" in ").append(formatDuration(duration))
                .append(", ").append(entries.size()).append(entries.size() == 1 ? " chat" : " chats")
                .append("</div>\n");

        html.append("<ul>\n");
        for (Map.Entry<String, List<IndexEntry>> group : groupByAccount(entries).entrySet()) {
            html.append("<li>").append(HtmlText.escape(group.getKey())).append("\n<ul>\n");
            group.getValue().stream()
                    .sorted(Comparator.comparing(IndexEntry::getTitle, String.CASE_INSENSITIVE_ORDER))
                    .forEach(entry -> html.append("<li><a href=\"").append(link(page, entry.getChatPage()))
                            .append("\">").append(HtmlText.escape(entry.getTitle())).append("</a></li>\n"));
            html.append("</ul>\n</li>\n");
        }
        html.append("</ul>\n");
        closePage(html);
        write(page, html);
    }

    /** Groups keyed by their label, ordered case-insensitively. */
    static Map<String, List<IndexEntry>> groupByAccount(List<IndexEntry> entries) {
        Map<String, List<IndexEntry>> groups = new TreeMap<>(
                Comparator.comparing((String label) -> label, String.CASE_INSENSITIVE_ORDER)
                        .thenComparing(Comparator.<String>naturalOrder()));
        for (IndexEntry entry : entries) {
            groups.computeIfAbsent(groupLabel(entry), label -> new ArrayList<>()).add(entry);
        }
        return groups;
    }

    static String groupLabel(IndexEntry entry) {
        return entry.getNetwork() + " (" + entry.getAccountId() + ")";
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        return String.format("%dm %02ds", seconds / 60, seconds % 60);
    }
}
