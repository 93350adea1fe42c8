package dev.pekelund.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Fully assembled and validated receipt. This is the only shape handed to storage and to
 * the front-end, so every consumer can rely on the invariants enforced here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Receipt(
    Store store,
    LocalDate date,
    List<ReceiptItem> items,
    ReceiptTotals totals,
    PaymentInfo paymentInfo,
    double confidence,
    String rawText
) {

    public Receipt {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(totals, "totals");
        items = items == null ? List.of() : List.copyOf(items);
        if (items.isEmpty()) {
            throw new IllegalArgumentException("A receipt requires at least one item");
        }
        if (totals.total().signum() <= 0) {
            throw new IllegalArgumentException("A receipt requires a positive total");
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0, 1] but was " + confidence);
        }
        rawText = rawText == null ? "" : rawText;
    }
}
