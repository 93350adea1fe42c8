package dev.pekelund.receipts.extraction.ocr;

/**
 * Text recognition failure that is worth retrying (service unavailable, deadline exceeded).
 */
public class TransientOcrServiceException extends OcrServiceException {

    public TransientOcrServiceException(String message) {
        super(message);
    }

    public TransientOcrServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
