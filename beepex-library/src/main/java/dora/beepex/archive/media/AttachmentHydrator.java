package dora.beepex.archive.media;

import dora.beepex.archive.source.RemoteSource;
import dora.beepex.shared.dto.AssetDownloadDto;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Resolves attachment references to local files.
 * <p>
 * References that only exist on the network ({@code mxc://}, {@code localmxc://})
 * are downloaded by the remote service, all of them concurrently; everything
 * else is taken as a local file already. A reference that cannot be resolved for
 * any reason maps to {@link Optional#empty()}; no per-item failure escapes.
 */
@Slf4j
public class AttachmentHydrator {

    private static final String[] REMOTE_SCHEMES = {"mxc://", "localmxc://"};
    private static final String FILE_SCHEME = "file:";

    private final RemoteSource source;
    private final Duration timeout;

    public AttachmentHydrator(RemoteSource source, Duration timeout) {
        this.source = source;
        this.timeout = timeout;
    }

    /**
     * Hydrates every distinct reference and waits for all of them. The key set of
     * the result equals the set of references passed in.
     */
    public Map<String, Optional<Path>> hydrate(Collection<String> remoteRefs) {
        Map<String, CompletableFuture<Optional<Path>>> pending = new LinkedHashMap<>();
        for (String ref : new LinkedHashSet<>(remoteRefs)) {
            pending.put(ref, hydrateOne(ref));
        }
        CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0])).join();

        Map<String, Optional<Path>> results = new LinkedHashMap<>();
        pending.forEach((ref, future) -> results.put(ref, future.join()));
        long unresolved = results.values().stream().filter(Optional::isEmpty).count();
        log.debug("Hydrated {} attachment reference(s), {} unresolved", results.size(), unresolved);
        return results;
    }

    private CompletableFuture<Optional<Path>> hydrateOne(String ref) {
        CompletableFuture<Optional<Path>> future;
        if (needsHydration(ref)) {
            try {
                future = source.downloadAsset(ref).thenApply(response -> fromDownload(ref, response));
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            if (!timeout.isZero() && !timeout.isNegative()) {
                future = future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } else {
            future = CompletableFuture.completedFuture(toLocalPath(ref));
        }
        return future
                .thenApply(path -> {
                    if (path.isEmpty() || !Files.isRegularFile(path.get())) {
                        log.warn("Attachment {} is not available locally", ref);
                        return Optional.<Path>empty();
                    }
                    return path;
                })
                .exceptionally(e -> {
                    log.warn("Failed to download attachment {}: {}", ref, e.getMessage());
                    return Optional.empty();
                });
    }

    private Optional<Path> fromDownload(String ref, AssetDownloadDto response) {
        if (response == null) {
            return Optional.empty();
        }
        if (response.getError() != null && !response.getError().isBlank()) {
            log.warn("Service could not download attachment {}: {}", ref, response.getError());
            return Optional.empty();
        }
        return response.getSrcUrl() == null ? Optional.empty() : toLocalPath(response.getSrcUrl());
    }

    public static boolean needsHydration(String ref) {
        for (String scheme : REMOTE_SCHEMES) {
            if (ref.startsWith(scheme)) {
                return true;
            }
        }
        return false;
    }

    /** Accepts {@code file:} URLs and plain paths. */
    static Optional<Path> toLocalPath(String location) {
        try {
            if (location.startsWith(FILE_SCHEME)) {
                try {
                    return Optional.of(Paths.get(URI.create(location)));
                } catch (IllegalArgumentException e) {
                    // Unencoded characters in the URL; take the path part literally.
                    String path = location.substring(FILE_SCHEME.length()).replaceFirst("^//", "");
                    return Optional.of(Paths.get(path.startsWith("/") ? path : "/" + path));
                }
            }
            return Optional.of(Paths.get(location));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
