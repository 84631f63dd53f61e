package dora.beepex.archive.source;

/**
 * The data returned by the service contradicts itself (a message filed under the
 * wrong chat, a chat listed twice). The export stops instead of producing a
 * silently incomplete archive.
 */
public class ArchiveIntegrityException extends RuntimeException {
    public ArchiveIntegrityException(String message) {
        super(message);
    }
}
