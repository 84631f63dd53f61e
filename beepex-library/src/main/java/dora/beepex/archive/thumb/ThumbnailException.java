package dora.beepex.archive.thumb;

/**
 * A thumbnail worker failed. Raised once, at the point where the export waits for
 * the thumbnail queue, and fatal to the run.
 */
public class ThumbnailException extends RuntimeException {
    public ThumbnailException(String message, Throwable cause) {
        super(message, cause);
    }
}
