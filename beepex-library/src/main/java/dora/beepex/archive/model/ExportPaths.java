package dora.beepex.archive.model;

import lombok.Getter;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Output locations of one chat plus what happened to each of its attachment
 * references. The maps are keyed by remote reference, not by attachment, because
 * several attachments may share one reference and must share one archived file.
 * An empty {@link Optional} marks an unresolved reference.
 */
@Getter
public class ExportPaths {
    private final Path chatPage;
    private final Path galleryPage;
    private final Path mediaDir;
    private final Path thumbnailDir;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Optional<Path>> hydrated = new LinkedHashMap<>();
    private final Map<String, Optional<Path>> archived = new LinkedHashMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Path> thumbnails = new LinkedHashMap<>();

    public ExportPaths(Path chatPage, Path galleryPage, Path mediaDir, Path thumbnailDir) {
        this.chatPage = chatPage;
        this.galleryPage = galleryPage;
        this.mediaDir = mediaDir;
        this.thumbnailDir = thumbnailDir;
    }

    public void recordHydrated(Map<String, Optional<Path>> results) {
        hydrated.putAll(results);
    }

    public Optional<Path> hydratedPath(String remoteRef) {
        return hydrated.getOrDefault(remoteRef, Optional.empty());
    }

    public boolean isArchived(String remoteRef) {
        return archived.containsKey(remoteRef);
    }

    public void recordArchived(String remoteRef, Optional<Path> archivedPath) {
        archived.put(remoteRef, archivedPath);
    }

    public Optional<Path> archivedPath(String remoteRef) {
        return archived.getOrDefault(remoteRef, Optional.empty());
    }

    public void recordThumbnail(String remoteRef, Path thumbnail) {
        thumbnails.put(remoteRef, thumbnail);
    }

    public Optional<Path> thumbnailPath(String remoteRef) {
        return Optional.ofNullable(thumbnails.get(remoteRef));
    }

    public Map<String, Optional<Path>> getArchived() {
        return Collections.unmodifiableMap(archived);
    }
}
