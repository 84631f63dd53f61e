package dora.beepex.archive.title;

import dora.beepex.archive.model.Chat;
import dora.beepex.archive.model.Message;
import dora.beepex.archive.model.User;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Derives the display title of a chat.
 * <p>
 * Networks title one-to-one and untitled group chats after the account owner,
 * which is useless in an export made by that owner. In that case the title is
 * built from the other senders instead: a message-count histogram seeded with
 * every participant, sorted ascending, first {@value #MAX_NAMES} names.
 * Existing exports are named this way, so the ascending order is kept as is.
 */
public final class TitleResolver {

    static final int MAX_NAMES = 4;
    static final String SEPARATOR = ", ";

    private TitleResolver() {
    }

    public static String resolve(Chat chat) {
        String rawTitle = chat.getRawTitle();
        Optional<User> self = chat.selfUser();
        if (self.isEmpty() || !rawTitle.equals(self.get().getDisplayName())) {
            return nonEmpty(rawTitle, chat);
        }

        Map<String, Integer> histogram = new LinkedHashMap<>();
        for (User participant : chat.getParticipants()) {
            histogram.put(participant.getId(), 0);
        }
        for (Message message : chat.getMessages()) {
            if (!message.isBlank()) {
                // Senders missing from the participant list still count.
                histogram.merge(message.getSenderId(), 1, Integer::sum);
            }
        }
        histogram.remove(self.get().getId());

        List<String> names = histogram.entrySet().stream()
                .sorted(Map.Entry.comparingByValue())
                .limit(MAX_NAMES)
                .map(entry -> chat.displayNameOf(entry.getKey()))
                .collect(Collectors.toList());
        String title = String.join(SEPARATOR, names);
        return title.isBlank() ? nonEmpty(rawTitle, chat) : title;
    }

    private static String nonEmpty(String rawTitle, Chat chat) {
        return rawTitle.isBlank() ? chat.getId() : rawTitle;
    }
}
