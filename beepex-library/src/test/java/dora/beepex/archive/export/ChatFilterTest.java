package dora.beepex.archive.export;

import dora.beepex.shared.dto.ChatDto;
import net.jqwik.api.*;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ChatFilterTest {

    private final List<ChatDto> chats = List.of(
            chat("c1", "whatsapp"),
            chat("c2", "signal"),
            chat("c3", "whatsapp"),
            chat("c4", "telegram"));

    private static ChatDto chat(String id, String accountId) {
        return ChatDto.builder().id(id).accountId(accountId).title(id).build();
    }

    private List<String> select(String... args) {
        return ChatFilter.parse(List.of(args)).apply(chats).stream().map(ChatDto::getId).collect(Collectors.toList());
    }

    @Example
    void noRulesSelectsEverything() {
        assertThat(select()).containsExactly("c1", "c2", "c3", "c4");
    }

    @Example
    void leadingIncludeStartsFromNothing() {
        assertThat(select("--include-account=whatsapp")).containsExactly("c1", "c3");
        assertThat(select("--include-chat=c4", "--include-chat=c2")).containsExactly("c2", "c4");
    }

    @Example
    void leadingExcludeStartsFromEverything() {
        assertThat(select("--exclude-account=whatsapp")).containsExactly("c2", "c4");
        assertThat(select("--exclude-chat=c2")).containsExactly("c1", "c3", "c4");
    }

    @Example
    void rulesApplyInOrder() {
        assertThat(select("--include-account=whatsapp", "--exclude-chat=c3")).containsExactly("c1");
        assertThat(select("--exclude-account=whatsapp", "--include-chat=c3")).containsExactly("c2", "c3", "c4");
        assertThat(select("--include-chat=c1", "--exclude-account=whatsapp", "--include-chat=c1"))
                .containsExactly("c1");
    }

    @Example
    void ignoresUnrelatedArguments() {
        ChatFilter filter = ChatFilter.parse(List.of("--beepex.output-dir=out", "--include-chat=c2", "extra"));

        assertThat(filter.getRules()).containsExactly(new ChatFilter.Rule(FilterOperation.INCLUDE_CHAT, "c2"));
    }

    @Example
    void ruleWithoutValueIsRejected() {
        assertThatThrownBy(() -> ChatFilter.parse(List.of("--exclude-chat=")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
