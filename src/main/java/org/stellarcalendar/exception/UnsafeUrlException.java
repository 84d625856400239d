package org.stellarcalendar.exception;

/**
 * Exception thrown when an outbound URL is rejected by the SSRF guard.
 */
public class UnsafeUrlException extends RuntimeException {

    public UnsafeUrlException(String message) {
        super(message);
    }

    public UnsafeUrlException(String message, Throwable cause) {
        super(message, cause);
    }
}
