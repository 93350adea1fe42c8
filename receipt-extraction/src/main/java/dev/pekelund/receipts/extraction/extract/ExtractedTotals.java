package dev.pekelund.receipts.extraction.extract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedTotals(
    ExtractedField<BigDecimal> subtotal,
    ExtractedField<BigDecimal> tax,
    ExtractedField<BigDecimal> total,
    ExtractedField<BigDecimal> tip,
    ExtractedField<BigDecimal> discount
) {

    public static final ExtractedTotals EMPTY = new ExtractedTotals(null, null, null, null, null);

    /**
     * @return {@code true} when none of subtotal, tax or total was found
     */
    @JsonIgnore
    public boolean isBlockAbsent() {
        return subtotal == null && tax == null && total == null;
    }

    public ExtractedTotals withDiscount(ExtractedField<BigDecimal> replacement) {
        return new ExtractedTotals(subtotal, tax, total, tip, replacement);
    }
}
