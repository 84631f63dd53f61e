package dora.beepex.archive.render;

import net.jqwik.api.*;

import static org.assertj.core.api.Assertions.assertThat;

public class HtmlTextTest {

    @Example
    void escapesAndKeepsLineBreaks() {
        assertThat(HtmlText.format("a < b & c\nline 2")).isEqualTo("a &lt; b &amp; c<br>\nline 2");
    }

    @Example
    void nullTextIsEmpty() {
        assertThat(HtmlText.escape(null)).isEmpty();
    }

    @Example
    void linksUrlsWithoutTrailingPunctuation() {
        assertThat(HtmlText.format("see https://example.com/x?a=1&b=2."))
                .isEqualTo("see <a href=\"https://example.com/x?a=1&amp;b=2\" rel=\"nofollow\">"
                        + "https://example.com/x?a=1&amp;b=2</a>.");
    }

    @Example
    void linksBareWwwAddresses() {
        assertThat(HtmlText.format("(www.example.org)"))
                .isEqualTo("(<a href=\"http://www.example.org\" rel=\"nofollow\">www.example.org</a>)");
    }

    @Example
    void keepsBalancedParentheses() {
        assertThat(HtmlText.format("https://en.wikipedia.org/wiki/Java_(programming_language)"))
                .contains("href=\"https://en.wikipedia.org/wiki/Java_(programming_language)\"");
    }

    @Example
    void quotedUrlStopsAtQuote() {
        assertThat(HtmlText.format("\"https://a.com\""))
                .isEqualTo("&quot;<a href=\"https://a.com\" rel=\"nofollow\">https://a.com</a>&quot;");
    }

    @Example
    void urlBeforeLineBreak() {
        assertThat(HtmlText.format("https://a.com\nnext"))
                .isEqualTo("<a href=\"https://a.com\" rel=\"nofollow\">https://a.com</a><br>\nnext");
    }

    @Example
    void markupIsNeverInjected() {
        assertThat(HtmlText.format("<script>alert(1)</script> https://x.org/<b>"))
                .doesNotContain("<script>", "<b>");
    }
}
