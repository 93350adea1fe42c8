package dev.pekelund.receipts.extraction.scoring;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Weights and penalties used when aggregating field confidences.
 */
public record ScoringWeights(
    double storeWeight,
    double totalsWeight,
    BigDecimal reconciliationTolerance,
    double mismatchPenalty,
    double missingTotalsPenalty
) {

    public static final ScoringWeights DEFAULTS =
        new ScoringWeights(1.0, 2.0, new BigDecimal("0.01"), 0.7, 0.8);

    public ScoringWeights {
        Objects.requireNonNull(reconciliationTolerance, "reconciliationTolerance");
        if (storeWeight < 0.0 || totalsWeight < 0.0) {
            throw new IllegalArgumentException("Scoring weights must not be negative");
        }
        if (reconciliationTolerance.signum() < 0) {
            throw new IllegalArgumentException("Reconciliation tolerance must not be negative");
        }
        requirePenalty(mismatchPenalty, "mismatchPenalty");
        requirePenalty(missingTotalsPenalty, "missingTotalsPenalty");
    }

    private static void requirePenalty(double value, String name) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be within (0, 1]");
        }
    }
}
