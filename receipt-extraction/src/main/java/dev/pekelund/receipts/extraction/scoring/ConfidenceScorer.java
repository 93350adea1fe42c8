package dev.pekelund.receipts.extraction.scoring;

import dev.pekelund.receipts.extraction.extract.ExtractedField;
import dev.pekelund.receipts.extraction.extract.ExtractedItem;
import dev.pekelund.receipts.extraction.extract.ExtractedReceipt;
import dev.pekelund.receipts.extraction.extract.ExtractedTotals;
import dev.pekelund.receipts.extraction.extract.FieldConfidencePolicy;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted mean of store, item and totals confidences. Items are weighted by their share of the
 * receipt total. A totals mismatch beyond the tolerance multiplies the result by the mismatch
 * penalty and adds a warning; it never fails scoring.
 */
public class ConfidenceScorer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfidenceScorer.class);

    private final ScoringWeights weights;

    public ConfidenceScorer(ScoringWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public ConfidenceReport score(ExtractedReceipt receipt) {
        Objects.requireNonNull(receipt, "receipt");
        List<String> warnings = new ArrayList<>();

        double storeConfidence = receipt.store() != null ? receipt.store().confidence() : 0.0;
        double totalsConfidence = totalsConfidence(receipt.totals());

        List<Double> itemConfidences = new ArrayList<>();
        for (ExtractedItem item : receipt.items()) {
            itemConfidences.add(itemConfidence(item));
        }
        List<Double> itemWeights = itemWeights(receipt);

        double weightedSum = weights.storeWeight() * storeConfidence + weights.totalsWeight() * totalsConfidence;
        double weightTotal = weights.storeWeight() + weights.totalsWeight();
        for (int index = 0; index < itemConfidences.size(); index++) {
            weightedSum += itemWeights.get(index) * itemConfidences.get(index);
            weightTotal += itemWeights.get(index);
        }
        double confidence = weightTotal > 0.0 ? weightedSum / weightTotal : 0.0;

        Reconciliation reconciliation = reconcile(receipt.totals());
        if (reconciliation.isMismatch()) {
            confidence *= weights.mismatchPenalty();
            String warning = "Totals do not reconcile: subtotal + tax - discount differs from total by "
                + reconciliation.difference().toPlainString();
            warnings.add(warning);
            LOGGER.warn(warning);
        }

        return new ConfidenceReport(FieldConfidencePolicy.clamp(confidence), storeConfidence, totalsConfidence,
            itemConfidences, reconciliation, warnings);
    }

    /**
     * Compares {@code subtotal + tax - discount} with the total. Runs only when both subtotal and
     * total were extracted; tip is not part of the check.
     */
    public Reconciliation reconcile(ExtractedTotals totals) {
        if (totals == null || totals.subtotal() == null || totals.total() == null) {
            return Reconciliation.NOT_CHECKED;
        }
        BigDecimal difference = totals.subtotal().value()
            .add(valueOrZero(totals.tax()))
            .subtract(valueOrZero(totals.discount()))
            .subtract(totals.total().value());
        Reconciliation.Status status = difference.abs().compareTo(weights.reconciliationTolerance()) > 0
            ? Reconciliation.Status.MISMATCH
            : Reconciliation.Status.BALANCED;
        return new Reconciliation(status, difference);
    }

    static double itemConfidence(ExtractedItem item) {
        return (item.name().confidence() + item.price().confidence() + item.quantity().confidence()) / 3.0;
    }

    private static double totalsConfidence(ExtractedTotals totals) {
        return Stream.of(totals.subtotal(), totals.tax(), totals.total(), totals.tip(), totals.discount())
            .filter(Objects::nonNull)
            .mapToDouble(ExtractedField::confidence)
            .average()
            .orElse(0.0);
    }

    private static List<Double> itemWeights(ExtractedReceipt receipt) {
        List<ExtractedItem> items = receipt.items();
        BigDecimal itemSum = items.stream()
            .map(item -> item.price().value().abs())
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal denominator = receipt.totals().total() != null && receipt.totals().total().value().signum() > 0
            ? receipt.totals().total().value()
            : itemSum;

        List<Double> itemWeights = new ArrayList<>(items.size());
        for (ExtractedItem item : items) {
            itemWeights.add(denominator.signum() > 0
                ? item.price().value().abs().doubleValue() / denominator.doubleValue()
                : 1.0 / items.size());
        }
        return itemWeights;
    }

    private static BigDecimal valueOrZero(ExtractedField<BigDecimal> field) {
        return field != null ? field.value() : BigDecimal.ZERO;
    }
}
