package dora.beepex.archive.render;

import org.apache.commons.text.StringEscapeUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns message text into HTML: escaped, line breaks kept, web addresses linked.
 */
public final class HtmlText {

    // Runs on escaped text, where the only '<' left are the inserted <br> tags.
    private static final Pattern URL = Pattern.compile("(?i)\\b(?:https?://|www\\.)[^\\s<]+");
    private static final Pattern TRAILING_ENTITY = Pattern.compile("&(?:[a-zA-Z]+|#\\d+);$");
    private static final String[] URL_TERMINATORS = {"&quot;", "&lt;", "&gt;"};
    private static final String TRAILING_PUNCTUATION = ".,:;!?'])}";

    private HtmlText() {
    }

    public static String escape(String text) {
        return text == null ? "" : StringEscapeUtils.escapeHtml4(text);
    }

    public static String format(String text) {
        return linkify(escape(text).replace("\n", "<br>\n"));
    }

    static String linkify(String escaped) {
        Matcher matcher = URL.matcher(escaped);
        StringBuilder out = new StringBuilder();
        int last = 0;
        while (matcher.find()) {
            String url = trimUrl(matcher.group());
            if (url.isEmpty() || url.equalsIgnoreCase("www.")) {
                continue;
            }
            int start = matcher.start();
            out.append(escaped, last, start);
            String href = url.regionMatches(true, 0, "www.", 0, 4) ? "http://" + url : url;
            out.append("<a href=\"").append(href).append("\" rel=\"nofollow\">").append(url).append("</a>");
            last = start + url.length();
        }
        out.append(escaped.substring(last));
        return out.toString();
    }

    private static String trimUrl(String candidate) {
        String url = candidate;
        for (String terminator : URL_TERMINATORS) {
            int at = url.indexOf(terminator);
            if (at >= 0) {
                url = url.substring(0, at);
            }
        }
        while (!url.isEmpty()) {
            char last = url.charAt(url.length() - 1);
            if (TRAILING_PUNCTUATION.indexOf(last) < 0) {
                break;
            }
            if (last == ';' && TRAILING_ENTITY.matcher(url).find()) {
                break;
            }
            if (last == ')' && count(url, '(') >= count(url, ')')) {
                break;
            }
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    private static int count(String s, char c) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
