package dev.pekelund.receipts.extraction.ocr;

import java.util.Objects;

/**
 * Text block reported by the vision service together with its recognition confidence.
 */
public record OcrRegion(String text, double confidence, BoundingBox boundingBox) {

    public OcrRegion {
        Objects.requireNonNull(text, "text");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Region confidence must be within [0, 1] but was " + confidence);
        }
    }
}
