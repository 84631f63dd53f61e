package dora.beepex.archive.render;

import net.jqwik.api.*;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

public class RelativeLinksTest {

    private final Path root = Paths.get("/export").toAbsolutePath();

    @Example
    void linksFromNestedPageUpAndDown() {
        Path chatPage = root.resolve("chat/acct/Ann.html");

        assertThat(RelativeLinks.href(chatPage, root.resolve("gallery/acct/Ann.html")))
                .isEqualTo("../../gallery/acct/Ann.html");
        assertThat(RelativeLinks.href(chatPage, root.resolve("media/full/acct/Ann/2024_a.png")))
                .isEqualTo("../../media/full/acct/Ann/2024_a.png");
    }

    @Example
    void linksFromRootPage() {
        assertThat(RelativeLinks.href(root.resolve("index.html"), root.resolve("chat/acct/Ann.html")))
                .isEqualTo("chat/acct/Ann.html");
    }

    @Example
    void sameDirectory() {
        assertThat(RelativeLinks.href(root.resolve("a/x.html"), root.resolve("a/y.html"))).isEqualTo("y.html");
        assertThat(RelativeLinks.href(root.resolve("a/x.html"), root.resolve("a"))).isEqualTo(".");
    }

    @Example
    void percentEncodesEverySegment() {
        Path page = root.resolve("chat/acct/Family chat.html");

        assertThat(RelativeLinks.href(page, root.resolve("media/full/acct/Family chat/100% #1?.png")))
                .isEqualTo("../../media/full/acct/Family%20chat/100%25%20%231%3F.png");
    }
}
