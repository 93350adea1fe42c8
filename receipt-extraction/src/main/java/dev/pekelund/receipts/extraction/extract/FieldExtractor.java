package dev.pekelund.receipts.extraction.extract;

import dev.pekelund.receipts.extraction.sanitize.SanitizedText;

/**
 * Extraction strategy for one receipt layout.
 */
public interface FieldExtractor {

    /**
     * Extracts candidate fields. Never fails because a field is missing; absent values are left
     * out of the result.
     *
     * @param text sanitized receipt text
     * @param regions OCR region confidences, {@link RegionConfidence#NONE} when unknown
     * @return the extracted fields
     */
    ExtractedReceipt extract(SanitizedText text, RegionConfidence regions);
}
