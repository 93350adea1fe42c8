package dev.pekelund.receipts.extraction.pipeline;

import java.util.Locale;

/**
 * Per-request processing states in the order they are reached.
 */
public enum PipelineStage {
    RECEIVED,
    OCR_COMPLETE,
    SANITIZED,
    TEMPLATE_SELECTED,
    FIELDS_EXTRACTED,
    SCORED,
    ASSEMBLED;

    public String logName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
