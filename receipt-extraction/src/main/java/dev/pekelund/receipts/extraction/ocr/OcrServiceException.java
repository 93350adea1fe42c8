package dev.pekelund.receipts.extraction.ocr;

/**
 * Raised when text recognition fails permanently, for example for an invalid image, a quota
 * or an authentication failure. These failures are surfaced without retrying.
 */
public class OcrServiceException extends RuntimeException {

    public OcrServiceException(String message) {
        super(message);
    }

    public OcrServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isTransient() {
        return false;
    }
}
