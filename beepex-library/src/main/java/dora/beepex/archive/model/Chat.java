package dora.beepex.archive.model;

import dora.beepex.archive.title.TitleResolver;
import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.Optional;

/**
 * A conversation of one account on one network. Participants are fixed at
 * construction; the message list is attached once after it has been fetched and
 * normalized, after which the display title is computed and cached.
 */
@Getter
public class Chat {
    private final String id;
    private final String accountId;
    private final String network;
    private final String rawTitle;
    private final List<User> participants;

    private List<Message> messages;
    @Getter(lombok.AccessLevel.NONE)
    private String title;

    public Chat(@NonNull String id, @NonNull String accountId, @NonNull String network,
                @NonNull String rawTitle, @NonNull List<User> participants) {
        this.id = id;
        this.accountId = accountId;
        this.network = network;
        this.rawTitle = rawTitle;
        this.participants = List.copyOf(participants);
        this.messages = List.of();
    }

    public void attachMessages(@NonNull List<Message> messages) {
        if (title != null) {
            throw new IllegalStateException("Messages of chat " + id + " are already frozen");
        }
        this.messages = List.copyOf(messages);
    }

    public Optional<User> selfUser() {
        return participants.stream().filter(User::isSelf).findFirst();
    }

    public Optional<User> participant(String userId) {
        return participants.stream().filter(user -> user.getId().equals(userId)).findFirst();
    }

    public String displayNameOf(String userId) {
        return participant(userId).map(User::getDisplayName).orElse(userId);
    }

    public synchronized String getTitle() {
        if (title == null) {
            title = TitleResolver.resolve(this);
        }
        return title;
    }
}
