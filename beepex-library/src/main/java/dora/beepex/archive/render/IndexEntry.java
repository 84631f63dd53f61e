package dora.beepex.archive.render;

import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/** One exported chat as listed on the index page. */
@Value
public class IndexEntry {
    @NonNull
    String accountId;

    @NonNull
    String network;

    @NonNull
    String title;

    @NonNull
    Path chatPage;
}
