package dora.beepex.archive.media;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * File name rules shared by every path segment the export derives from titles,
 * ids and attachment names. Names have to survive the strictest file system the
 * export may be copied to, so Windows rules apply everywhere.
 */
public final class FileNames {

    private static final Set<String> RESERVED_NAMES = Set.of(
            "aux", "con", "nul", "prn",
            "com0", "com1", "com2", "com3", "com4", "com5", "com6", "com7", "com8", "com9",
            "lpt0", "lpt1", "lpt2", "lpt3", "lpt4", "lpt5", "lpt6", "lpt7", "lpt8", "lpt9");

    private static final Pattern RESERVED_CHARS = Pattern.compile("[\"*/:<>?\\\\|]");
    private static final String TRIMMED_CHARS = " \t\n.";
    private static final String EMPTY_REPLACEMENT = "_";

    private FileNames() {
    }

    /**
     * Makes {@code name} usable as a single path segment: reserved device names
     * get a trailing underscore, reserved characters are removed, surrounding
     * blanks and periods are trimmed and an empty result becomes {@code "_"}.
     * Applying it twice gives the same result as applying it once.
     */
    public static String sanitize(String name) {
        String result = name;
        if (isReservedName(result)) {
            result = result + "_";
        }
        result = stripReservedCharacters(result);
        result = trim(result);
        if (result.isEmpty()) {
            return EMPTY_REPLACEMENT;
        }
        // Stripping and trimming can expose a device name ("con." -> "con").
        return isReservedName(result) ? result + "_" : result;
    }

    public static String stripReservedCharacters(String name) {
        return RESERVED_CHARS.matcher(name).replaceAll("");
    }

    /** Extension including the dot, or an empty string; a leading dot does not start one. */
    public static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(dot) : "";
    }

    public static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static boolean isReservedName(String name) {
        return RESERVED_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    private static String trim(String name) {
        int start = 0;
        int end = name.length();
        while (start < end && TRIMMED_CHARS.indexOf(name.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TRIMMED_CHARS.indexOf(name.charAt(end - 1)) >= 0) {
            end--;
        }
        return name.substring(start, end);
    }
}
