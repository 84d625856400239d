package org.stellarcalendar.exception;

/**
 * Exception thrown when a remote ActivityPub document cannot be fetched or parsed.
 */
public class RemoteFetchException extends RuntimeException {

    public RemoteFetchException(String message) {
        super(message);
    }

    public RemoteFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
