package dev.pekelund.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReceiptItem(
    String name,
    BigDecimal price,
    int quantity,
    BigDecimal unitPrice,
    String category,
    BigDecimal taxRate,
    double confidence
) {

    public ReceiptItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(price, "price");
        if (price.signum() < 0) {
            throw new IllegalArgumentException("Item price must not be negative: " + price);
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("Item quantity must be at least 1: " + quantity);
        }
        if (unitPrice != null && unitPrice.signum() < 0) {
            throw new IllegalArgumentException("Item unit price must not be negative: " + unitPrice);
        }
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be within [0, 1] but was " + confidence);
        }
    }
}
