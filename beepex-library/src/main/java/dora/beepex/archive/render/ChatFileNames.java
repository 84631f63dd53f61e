package dora.beepex.archive.render;

import dora.beepex.archive.media.FileNames;
import dora.beepex.archive.model.Chat;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Hands out page names for the chats of one run. Two chats of the same account
 * with the same title (case-insensitively) must not share a page, so the second
 * one gets its id appended, and a counter on top when even that is taken.
 */
public class ChatFileNames {

    private final Map<String, Set<String>> takenByAccount = new HashMap<>();

    public static String accountDir(String accountId) {
        return FileNames.sanitize(accountId.toLowerCase(Locale.ROOT));
    }

    public synchronized String allocate(Chat chat) {
        Set<String> taken = takenByAccount.computeIfAbsent(accountDir(chat.getAccountId()), key -> new HashSet<>());
        String name = FileNames.sanitize(chat.getTitle());
        if (taken.add(name.toLowerCase(Locale.ROOT))) {
            return name;
        }
        String base = FileNames.sanitize(chat.getTitle() + " " + chat.getId());
        name = base;
        for (int counter = 2; !taken.add(name.toLowerCase(Locale.ROOT)); counter++) {
            name = base + " " + counter;
        }
        return name;
    }
}
