package dev.pekelund.receipts.extraction.sanitize;

/**
 * Raised when receipt text uses a character encoding that can not be decoded at all.
 */
public class SanitizationException extends RuntimeException {

    public SanitizationException(String message) {
        super(message);
    }

    public SanitizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
