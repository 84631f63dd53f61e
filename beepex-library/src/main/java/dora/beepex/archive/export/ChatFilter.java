package dora.beepex.archive.export;

import dora.beepex.shared.dto.ChatDto;
import lombok.NonNull;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Selects chats by account and chat id. Rules apply in the order given, each one
 * adding matching chats to or removing them from the selection. The selection
 * starts empty when the first rule includes, and full otherwise.
 */
public class ChatFilter {

    @Value
    public static class Rule {
        @NonNull
        FilterOperation operation;

        @NonNull
        String value;

        boolean matches(ChatDto chat) {
            String field = operation.isByAccount() ? chat.getAccountId() : chat.getId();
            return Objects.equals(value, field);
        }
    }

    private final List<Rule> rules;

    public ChatFilter(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ChatFilter all() {
        return new ChatFilter(List.of());
    }

    /**
     * Reads rules from {@code --include-account=}, {@code --exclude-account=},
     * {@code --include-chat=} and {@code --exclude-chat=} arguments, keeping their
     * order. Other arguments are ignored.
     *
     * @throws IllegalArgumentException for a rule without a value
     */
    public static ChatFilter parse(List<String> args) {
        List<Rule> rules = new ArrayList<>();
        for (String arg : args) {
            for (FilterOperation operation : FilterOperation.values()) {
                if (arg.startsWith(operation.getOption())) {
                    String value = arg.substring(operation.getOption().length());
                    if (value.isEmpty()) {
                        throw new IllegalArgumentException("Missing value for " + operation.getOption());
                    }
                    rules.add(new Rule(operation, value));
                }
            }
        }
        return new ChatFilter(rules);
    }

    public List<Rule> getRules() {
        return rules;
    }

    /** Chats selected from {@code chats}, in their original order. */
    public List<ChatDto> apply(List<ChatDto> chats) {
        if (rules.isEmpty()) {
            return List.copyOf(chats);
        }
        Set<ChatDto> selected = new LinkedHashSet<>();
        if (!rules.get(0).getOperation().isInclude()) {
            selected.addAll(chats);
        }
        for (Rule rule : rules) {
            for (ChatDto chat : chats) {
                if (rule.matches(chat)) {
                    if (rule.getOperation().isInclude()) {
                        selected.add(chat);
                    } else {
                        selected.remove(chat);
                    }
                }
            }
        }
        return chats.stream().filter(selected::contains).collect(Collectors.toList());
    }
}
