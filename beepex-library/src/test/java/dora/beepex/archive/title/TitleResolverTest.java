package dora.beepex.archive.title;

import dora.beepex.archive.model.Chat;
import dora.beepex.archive.model.Message;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.List;

import static dora.beepex.archive.Fixtures.chat;
import static dora.beepex.archive.Fixtures.message;
import static dora.beepex.archive.Fixtures.self;
import static dora.beepex.archive.Fixtures.text;
import static dora.beepex.archive.Fixtures.user;
import static org.assertj.core.api.Assertions.assertThat;

public class TitleResolverTest {

    @Example
    void keepsTitleThatIsNotTheOwnersName() {
        Chat chat = chat("c1", "Book club", self("me", "Dora"), user("ann", "Ann"));
        chat.attachMessages(List.of(text("m1", "ann", 0)));

        assertThat(chat.getTitle()).isEqualTo("Book club");
    }

    @Example
    void keepsTitleWithoutSelfParticipant() {
        Chat chat = chat("c1", "Dora", user("dora", "Dora"), user("ann", "Ann"));

        assertThat(TitleResolver.resolve(chat)).isEqualTo("Dora");
    }

    @Example
    void blankTitleFallsBackToChatId() {
        Chat chat = chat("c1", " ", user("ann", "Ann"));

        assertThat(TitleResolver.resolve(chat)).isEqualTo("c1");
    }

    @Example
    void ownersNameIsReplacedByLeastActiveSenders() {
        Chat chat = chat("c1", "Dora", self("me", "Dora"),
                user("a", "Alice"), user("b", "Bob"), user("c", "Carol"), user("d", "Dave"), user("e", "Eve"));
        List<Message> messages = new ArrayList<>();
        int minute = 0;
        String[] senders = {"a", "b", "c", "d", "e"};
        for (int i = 0; i < senders.length; i++) {
            // a sends 5 messages, e sends 1
            for (int n = 0; n < senders.length - i; n++) {
                messages.add(text("m" + minute, senders[i], minute++));
            }
        }
        messages.add(text("m-self", "me", minute));
        chat.attachMessages(messages);

        String title = chat.getTitle();

        assertThat(title).isEqualTo("Eve, Dave, Carol, Bob");
        assertThat(title.split(", ")).hasSizeLessThanOrEqualTo(TitleResolver.MAX_NAMES);
    }

    @Example
    void silentParticipantsComeFirst() {
        Chat chat = chat("c1", "Dora", self("me", "Dora"), user("a", "Alice"), user("b", "Bob"), user("z", "Zed"));
        chat.attachMessages(List.of(
                text("m1", "a", 0),
                text("m2", "b", 1),
                text("m3", "b", 2)));

        assertThat(chat.getTitle()).isEqualTo("Zed, Alice, Bob");
    }

    @Example
    void blankMessagesAreNotCounted() {
        Chat chat = chat("c1", "Dora", self("me", "Dora"), user("a", "Alice"), user("b", "Bob"));
        chat.attachMessages(List.of(
                text("m1", "a", 0),
                message("m2", "b", 1).build(),
                message("m3", "b", 2).build()));

        assertThat(chat.getTitle()).isEqualTo("Bob, Alice");
    }

    @Example
    void unlistedSendersUseTheirId() {
        Chat chat = chat("c1", "Dora", self("me", "Dora"));
        chat.attachMessages(List.of(text("m1", "@stranger:beeper.com", 0)));

        assertThat(chat.getTitle()).isEqualTo("@stranger:beeper.com");
    }

    @Example
    void onlyOwnerFallsBackToRawTitle() {
        Chat chat = chat("c1", "Dora", self("me", "Dora"));
        chat.attachMessages(List.of(text("m1", "me", 0)));

        assertThat(chat.getTitle()).isEqualTo("Dora");
    }
}
