package dora.beepex.archive.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class Reaction {
    String id;

    @NonNull
    String reactingUserId;

    @NonNull
    String key;
}
