package dora.beepex.archive.render;

import dora.beepex.archive.model.Chat;
import net.jqwik.api.*;
import net.jqwik.api.constraints.Size;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class ChatFileNamesTest {

    private static Chat chat(String id, String accountId, String title) {
        return new Chat(id, accountId, "signal", title, List.of());
    }

    @Example
    void collidingTitlesGetChatIdAppended() {
        ChatFileNames names = new ChatFileNames();

        assertThat(names.allocate(chat("c1", "acct", "Family"))).isEqualTo("Family");
        assertThat(names.allocate(chat("c2", "acct", "family"))).isEqualTo("family c2");
        assertThat(names.allocate(chat("c3", "other", "Family"))).isEqualTo("Family");
    }

    @Example
    void titlesAreSanitized() {
        assertThat(new ChatFileNames().allocate(chat("c1", "acct", "Work: 2024/25?"))).isEqualTo("Work 202425");
    }

    @Example
    void accountDirIsLowercasedAndSanitized() {
        assertThat(ChatFileNames.accountDir("WhatsApp:+4912")).isEqualTo("whatsapp+4912");
        assertThat(ChatFileNames.accountDir("CON")).isEqualTo("con_");
    }

    @Example
    void disambiguatedNameThatIsAlreadyTakenGetsCounter() {
        ChatFileNames names = new ChatFileNames();

        assertThat(names.allocate(chat("x", "acct", "Foo 123"))).isEqualTo("Foo 123");
        assertThat(names.allocate(chat("a", "acct", "Foo"))).isEqualTo("Foo");
        assertThat(names.allocate(chat("123", "acct", "Foo"))).isEqualTo("Foo 123 2");
        assertThat(names.allocate(chat("123", "acct", "foo"))).isEqualTo("foo 123 3");
    }

    @Property
    void namesNeverCollideWithinAccount(
            @ForAll @Size(max = 30) List<@From("titles") String> titles,
            @ForAll @Size(max = 30) List<@From("ids") String> ids) {
        ChatFileNames names = new ChatFileNames();
        Set<String> seen = new HashSet<>();
        int count = Math.min(titles.size(), ids.size());
        for (int i = 0; i < count; i++) {
            String name = names.allocate(chat(ids.get(i), "acct", titles.get(i)));
            assertThat(seen.add(name.toLowerCase(Locale.ROOT))).as("duplicate %s", name).isTrue();
        }
    }

    @Provide
    Arbitrary<String> titles() {
        return Arbitraries.of("Foo", "foo", "Foo 1", "Foo 2", "Foo 1 2", "Bar");
    }

    @Provide
    Arbitrary<String> ids() {
        return Arbitraries.of("1", "2", "x");
    }
}
