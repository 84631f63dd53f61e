package dora.beepex.archive.render;

import dora.beepex.archive.media.AtomicFiles;
import dora.beepex.archive.model.ExportLayout;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Common page shell. Subclasses fill the body; every page links the shared
 * stylesheets relative to its own location.
 */
abstract class PageRenderer {

    protected final ExportLayout layout;

    protected PageRenderer(ExportLayout layout) {
        this.layout = layout;
    }

    protected void openPage(StringBuilder html, Path page, String title, String... stylesheets) {
        html.append("<!DOCTYPE html>\n")
                .append("<html lang=\"en\">\n")
                .append("<head>\n")
                .append("    <meta charset=\"UTF-8\">\n")
                .append("    <meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n")
                .append("    <title>").append(HtmlText.escape(title)).append("</title>\n");
        for (String stylesheet : stylesheets) {
            html.append("    <link rel=\"stylesheet\" href=\"")
                    .append(resource(page, stylesheet))
                    .append("\">\n");
        }
        html.append("</head>\n<body>\n");
    }

    protected void closePage(StringBuilder html) {
        html.append("</body>\n</html>\n");
    }

    protected String resource(Path page, String fileName) {
        return link(page, layout.resourceDir().resolve(fileName));
    }

    /** Relative link, escaped for use inside an attribute. */
    protected static String link(Path page, Path target) {
        return HtmlText.escape(RelativeLinks.href(page, target));
    }

    protected static void write(Path page, CharSequence html) {
        try {
            AtomicFiles.writeString(page, html.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + page, e);
        }
    }
}
