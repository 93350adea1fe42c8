package dev.pekelund.receipts.extraction.scoring;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate confidence plus the per-field scores it was computed from. {@code itemConfidences}
 * follows the order of the extracted items.
 */
public record ConfidenceReport(
    double confidence,
    double storeConfidence,
    double totalsConfidence,
    List<Double> itemConfidences,
    Reconciliation reconciliation,
    List<String> warnings
) {

    public ConfidenceReport {
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]");
        }
        itemConfidences = itemConfidences == null ? List.of() : List.copyOf(itemConfidences);
        Objects.requireNonNull(reconciliation, "reconciliation");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
