package dora.beepex.archive.media;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes files through a temporary sibling so that an interrupted export never
 * leaves a truncated file behind under its final name.
 */
public final class AtomicFiles {

    private static final String TEMP_PREFIX = ".beepex-";
    private static final String TEMP_SUFFIX = ".part";

    private AtomicFiles() {
    }

    public static Path createTempSibling(Path target) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        return Files.createTempFile(dir, TEMP_PREFIX, TEMP_SUFFIX);
    }

    /** Moves {@code temp} over {@code target}, atomically where the file system can. */
    public static void commit(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public static void writeString(Path target, String content) throws IOException {
        Path temp = createTempSibling(target);
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            commit(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public static void copy(Path source, Path target) throws IOException {
        Path temp = createTempSibling(target);
        try {
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            commit(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
