package dev.pekelund.receipts.extraction.ocr;

/**
 * Minimal client interface for the external text recognition capability.
 */
public interface VisionClient {

    /**
     * Runs text detection for the provided image.
     *
     * @param image the image to analyse
     * @return the recognised text and any region level confidences
     * @throws TransientOcrServiceException when the call may succeed if repeated
     * @throws OcrServiceException when the image or the account can not be processed
     */
    RawOcrResult detectText(ImagePayload image);
}
