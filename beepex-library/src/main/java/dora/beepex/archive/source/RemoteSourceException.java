package dora.beepex.archive.source;

import lombok.Getter;

/**
 * The remote service could not be reached or answered with an error.
 */
@Getter
public class RemoteSourceException extends RuntimeException {
    private final int statusCode;

    public RemoteSourceException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RemoteSourceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }
}
