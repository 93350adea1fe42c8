package dev.pekelund.receipts.extraction.assembly;

import dev.pekelund.receipts.extraction.extract.ExtractedField;
import dev.pekelund.receipts.extraction.extract.ExtractedItem;
import dev.pekelund.receipts.extraction.extract.ExtractedReceipt;
import dev.pekelund.receipts.extraction.extract.ExtractedTotals;
import dev.pekelund.receipts.extraction.extract.FieldConfidencePolicy;
import dev.pekelund.receipts.extraction.sanitize.SanitizedText;
import dev.pekelund.receipts.extraction.scoring.ConfidenceReport;
import dev.pekelund.receipts.model.PaymentInfo;
import dev.pekelund.receipts.model.Receipt;
import dev.pekelund.receipts.model.ReceiptItem;
import dev.pekelund.receipts.model.ReceiptTotals;
import dev.pekelund.receipts.model.Store;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the extracted fields, fills the totals that can be derived safely and produces the
 * final response. A receipt is only emitted with at least one item and a positive total; anything
 * else yields {@code success:false} carrying the partial extraction.
 */
public class ReceiptAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptAssembler.class);

    static final String NO_ITEMS = "No items found in receipt";
    static final String NO_TOTAL = "Receipt total amount is missing";
    static final String NON_POSITIVE_TOTAL = "Receipt total must be greater than zero";
    static final String UNKNOWN_STORE = "Unknown store";

    private final Clock clock;
    private final double missingTotalsPenalty;

    public ReceiptAssembler(Clock clock, double missingTotalsPenalty) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (!(missingTotalsPenalty > 0.0 && missingTotalsPenalty <= 1.0)) {
            throw new IllegalArgumentException("missingTotalsPenalty must be within (0, 1]");
        }
        this.missingTotalsPenalty = missingTotalsPenalty;
    }

    public ReceiptParsingResponse assemble(SanitizedText text, ExtractedReceipt extracted, ConfidenceReport report) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(extracted, "extracted");
        Objects.requireNonNull(report, "report");

        List<String> warnings = new ArrayList<>(text.warnings());
        warnings.addAll(extracted.warnings());
        warnings.addAll(report.warnings());

        ExtractedTotals totals = extracted.totals();
        if (extracted.items().isEmpty()) {
            List<String> errors = new ArrayList<>();
            errors.add(NO_ITEMS);
            if (totals.total() == null) {
                errors.add(NO_TOTAL);
            }
            errors.addAll(warnings);
            LOGGER.info("Receipt assembly failed: {}", errors);
            return ReceiptParsingResponse.partialFailure(extracted, text.text(), report.confidence(), errors);
        }

        double confidence = report.confidence();
        ReceiptTotals receiptTotals;
        if (totals.isBlockAbsent()) {
            receiptTotals = recomputeFromItems(extracted.items(), totals);
            confidence *= missingTotalsPenalty;
            warnings.add("Totals not found; subtotal and total recomputed from item prices with tax 0.00");
        } else {
            receiptTotals = deriveMissingTotals(extracted.items(), totals, warnings);
        }

        if (receiptTotals.total().signum() <= 0) {
            List<String> errors = new ArrayList<>();
            errors.add(NON_POSITIVE_TOTAL);
            errors.addAll(warnings);
            LOGGER.info("Receipt assembly failed: {}", errors);
            return ReceiptParsingResponse.partialFailure(extracted, text.text(), report.confidence(), errors);
        }

        Store store = extracted.store() != null ? extracted.store().value() : null;
        if (store == null) {
            store = Store.named(UNKNOWN_STORE);
            warnings.add("Store name not found");
        }

        LocalDate date = extracted.date() != null ? extracted.date().value() : null;
        if (date != null && date.isAfter(LocalDate.now(clock))) {
            warnings.add("Receipt date " + date + " is in the future");
        }

        PaymentInfo paymentInfo = extracted.payment() != null ? extracted.payment().value() : null;

        List<ReceiptItem> items = new ArrayList<>(extracted.items().size());
        for (int index = 0; index < extracted.items().size(); index++) {
            ExtractedItem item = extracted.items().get(index);
            double itemConfidence = index < report.itemConfidences().size()
                ? report.itemConfidences().get(index)
                : item.price().confidence();
            items.add(new ReceiptItem(
                item.name().value(),
                item.price().value(),
                item.quantity().value(),
                item.unitPrice() != null ? item.unitPrice().value() : null,
                item.category(),
                item.taxRate(),
                FieldConfidencePolicy.clamp(itemConfidence)));
        }

        Receipt receipt = new Receipt(store, date, items, receiptTotals, paymentInfo,
            FieldConfidencePolicy.clamp(confidence), text.text());
        LOGGER.info("Assembled receipt for '{}' with {} items, total {} and confidence {}", store.name(),
            items.size(), receiptTotals.total(), String.format(Locale.ROOT, "%.3f", receipt.confidence()));
        return ReceiptParsingResponse.success(receipt, warnings);
    }

    private static ReceiptTotals recomputeFromItems(List<ExtractedItem> items, ExtractedTotals totals) {
        BigDecimal itemSum = sumOfItems(items);
        BigDecimal discount = value(totals.discount());
        BigDecimal tip = value(totals.tip());
        BigDecimal total = itemSum.subtract(orZero(discount)).add(orZero(tip));
        return new ReceiptTotals(itemSum, zero(), total, tip, discount);
    }

    private static ReceiptTotals deriveMissingTotals(List<ExtractedItem> items, ExtractedTotals totals,
        List<String> warnings) {
        BigDecimal subtotal = value(totals.subtotal());
        BigDecimal tax = value(totals.tax());
        BigDecimal total = value(totals.total());
        BigDecimal tip = value(totals.tip());
        BigDecimal discount = value(totals.discount());

        if (tax == null) {
            tax = zero();
            warnings.add("Tax not found; assumed 0.00");
        }
        if (subtotal == null) {
            if (total != null) {
                subtotal = total.subtract(tax).add(orZero(discount)).subtract(orZero(tip));
                warnings.add("Subtotal derived from total, tax and discount");
            } else {
                subtotal = sumOfItems(items);
                warnings.add("Subtotal derived from item prices");
            }
        }
        if (total == null) {
            total = subtotal.add(tax).subtract(orZero(discount)).add(orZero(tip));
            warnings.add("Total derived from subtotal, tax and discount");
        }
        return new ReceiptTotals(subtotal, tax, total, tip, discount);
    }

    private static BigDecimal sumOfItems(List<ExtractedItem> items) {
        return items.stream()
            .map(item -> item.price().value())
            .reduce(zero(), BigDecimal::add);
    }

    private static BigDecimal value(ExtractedField<BigDecimal> field) {
        return field != null ? field.value() : null;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
    }
}
