package dora.beepex.archive.export;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FilterOperation {
    INCLUDE_ACCOUNT("--include-account=", true, true),
    EXCLUDE_ACCOUNT("--exclude-account=", false, true),
    INCLUDE_CHAT("--include-chat=", true, false),
    EXCLUDE_CHAT("--exclude-chat=", false, false);

    private final String option;
    private final boolean include;
    private final boolean byAccount;
}
