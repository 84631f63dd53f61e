package dora.beepex.archive.thumb;

import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

@Value
public class ThumbnailJob {
    @NonNull
    Path source;

    @NonNull
    Path target;

    int maxDimension;
}
