package dora.beepex.archive.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings of one export run. Built once at startup and handed to every component
 * that needs it.
 */
@Value
@Builder
public class ExportSettings {
    @NonNull
    Path outputRoot;

    /** Zone of the visible timestamps; UTC is always available as a tooltip. */
    @NonNull
    @Builder.Default
    ZoneId localZone = ZoneId.systemDefault();

    @Builder.Default
    int jpegMaxDimension = 512;

    /** Larger than the JPEG limit so that screenshots stay legible. */
    @Builder.Default
    int pngMaxDimension = 800;

    @Builder.Default
    float thumbnailQuality = 0.75f;

    @Builder.Default
    int thumbnailWorkers = 2;

    @Builder.Default
    int thumbnailQueueCapacity = 4096;

    /** Per-attachment hydration timeout, {@link Duration#ZERO} waits forever. */
    @NonNull
    @Builder.Default
    Duration hydrationTimeout = Duration.ZERO;

    /** Directory of the shared stylesheets and scripts, relative to {@link #outputRoot}. */
    @NonNull
    @Builder.Default
    String resourceDir = "media/beepex";
}
