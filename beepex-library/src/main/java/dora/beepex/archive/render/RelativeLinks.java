package dora.beepex.archive.render;

import com.google.common.base.Joiner;
import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Links between files of the export. They are relative to the directory of the
 * linking page, so the export can be moved or served from any prefix.
 */
public final class RelativeLinks {

    private static final Escaper SEGMENT_ESCAPER = UrlEscapers.urlPathSegmentEscaper();
    private static final Joiner SLASH = Joiner.on('/');

    private RelativeLinks() {
    }

    /**
     * Relative URL from the page {@code fromFile} to {@code target}: forward
     * slashes whatever the platform, every segment percent-encoded.
     */
    public static String href(Path fromFile, Path target) {
        Path fromDir = fromFile.toAbsolutePath().normalize().getParent();
        Path relative = fromDir.relativize(target.toAbsolutePath().normalize());
        List<String> segments = new ArrayList<>();
        for (Path segment : relative) {
            String name = segment.toString();
            if (!name.isEmpty()) {
                segments.add(SEGMENT_ESCAPER.escape(name));
            }
        }
        return segments.isEmpty() ? "." : SLASH.join(segments);
    }
}
