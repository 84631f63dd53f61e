package dora.beepex.archive.source;

import dora.beepex.archive.model.Message;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes the messages fetched for one chat.
 * <p>
 * The service can return the same message on two pages and does not always hand
 * out ordering keys that agree with send times, so messages are deduplicated by
 * id (first record wins) and sorted by timestamp, ordering key, then id.
 */
public final class MessageTimeline {

    static final Comparator<String> ORDERING_KEY = MessageTimeline::compareOrderingKeys;

    static final Comparator<Message> CHRONOLOGICAL = Comparator
            .comparing(Message::getTimestamp, (a, b) -> a.toInstant().compareTo(b.toInstant()))
            .thenComparing(Message::getOrderingKey, ORDERING_KEY)
            .thenComparing(Message::getId);

    private MessageTimeline() {
    }

    public static List<Message> normalize(Collection<Message> messages) {
        Map<String, Message> byId = new LinkedHashMap<>();
        for (Message message : messages) {
            if (!message.isBlank()) {
                byId.putIfAbsent(message.getId(), message);
            }
        }
        List<Message> result = new ArrayList<>(byId.values());
        result.sort(CHRONOLOGICAL);
        return result;
    }

    /** Integer keys compare numerically and sort before any other key. */
    static int compareOrderingKeys(String a, String b) {
        boolean aNumeric = isInteger(a);
        boolean bNumeric = isInteger(b);
        if (aNumeric && bNumeric) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        if (aNumeric != bNumeric) {
            return aNumeric ? -1 : 1;
        }
        return a.compareTo(b);
    }

    private static boolean isInteger(String value) {
        if (value.isEmpty()) {
            return false;
        }
        int start = value.charAt(0) == '-' ? 1 : 0;
        if (start == value.length()) {
            return false;
        }
        for (int i = start; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
