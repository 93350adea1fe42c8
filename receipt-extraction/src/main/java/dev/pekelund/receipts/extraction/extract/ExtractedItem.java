package dev.pekelund.receipts.extraction.extract;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Line item candidate. {@code lineIndex} is the position of the source line in the sanitized text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedItem(
    ExtractedField<String> name,
    ExtractedField<BigDecimal> price,
    ExtractedField<Integer> quantity,
    ExtractedField<BigDecimal> unitPrice,
    String category,
    BigDecimal taxRate,
    int lineIndex
) {

    public ExtractedItem {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(quantity, "quantity");
    }
}
