package dora.beepex.archive.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class User {
    @NonNull
    String id;

    /** Never empty: falls back to the id when the service knows nothing better. */
    @NonNull
    String displayName;

    boolean self;
}
