package org.stellarcalendar.exception;

/**
 * Exception thrown when an outbound request cannot be signed.
 */
public class HttpSignatureException extends RuntimeException {

    public HttpSignatureException(String message) {
        super(message);
    }

    public HttpSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
