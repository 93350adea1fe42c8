package dev.pekelund.receipts.extraction.extract;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.receipts.model.PaymentInfo;
import dev.pekelund.receipts.model.Store;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything the field extractor could find. Missing values are {@code null}; items keep the
 * order of their source lines.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractedReceipt(
    String templateId,
    ExtractedField<Store> store,
    ExtractedField<LocalDate> date,
    List<ExtractedItem> items,
    ExtractedTotals totals,
    ExtractedField<PaymentInfo> payment,
    List<String> warnings
) {

    public ExtractedReceipt {
        items = items == null ? List.of() : List.copyOf(items);
        totals = totals == null ? ExtractedTotals.EMPTY : totals;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
