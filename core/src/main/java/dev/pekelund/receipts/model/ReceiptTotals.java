package dev.pekelund.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Monetary totals of a receipt. Tip and discount are optional and absent when the
 * receipt does not print them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReceiptTotals(
    BigDecimal subtotal,
    BigDecimal tax,
    BigDecimal total,
    BigDecimal tip,
    BigDecimal discount
) {

    public ReceiptTotals {
        Objects.requireNonNull(subtotal, "subtotal");
        Objects.requireNonNull(tax, "tax");
        Objects.requireNonNull(total, "total");
    }
}
