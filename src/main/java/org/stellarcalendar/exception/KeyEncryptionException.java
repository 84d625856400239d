package org.stellarcalendar.exception;

/**
 * Exception thrown when a private key cannot be encrypted or decrypted.
 */
public class KeyEncryptionException extends RuntimeException {

    public KeyEncryptionException(String message) {
        super(message);
    }

    public KeyEncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
