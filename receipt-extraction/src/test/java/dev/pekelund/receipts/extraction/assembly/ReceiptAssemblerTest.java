package dev.pekelund.receipts.extraction.assembly;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.pekelund.receipts.extraction.extract.ExtractedField;
import dev.pekelund.receipts.extraction.extract.ExtractedItem;
import dev.pekelund.receipts.extraction.extract.ExtractedReceipt;
import dev.pekelund.receipts.extraction.extract.ExtractedTotals;
import dev.pekelund.receipts.extraction.extract.FieldSource;
import dev.pekelund.receipts.extraction.sanitize.SanitizedText;
import dev.pekelund.receipts.extraction.scoring.ConfidenceReport;
import dev.pekelund.receipts.extraction.scoring.Reconciliation;
import dev.pekelund.receipts.model.Receipt;
import dev.pekelund.receipts.model.ReceiptItem;
import dev.pekelund.receipts.model.Store;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReceiptAssemblerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final SanitizedText TEXT = new SanitizedText("SUPERMART\nMilk 3.50\nBread 2.00", List.of());
    private static final ExtractedField<Store> STORE =
        new ExtractedField<>(Store.named("SUPERMART"), 0.9, FieldSource.TEMPLATE);

    private final ReceiptAssembler assembler = new ReceiptAssembler(CLOCK, 0.8);

    @Test
    void assemblesReceiptWhenEverythingIsPresent() {
        ExtractedReceipt extracted = extracted(STORE, null, items(), totals("5.50", "0.44", "5.94"));

        ReceiptParsingResponse response = assembler.assemble(TEXT, extracted, report(0.8));

        assertThat(response.success()).isTrue();
        assertThat(response.errors()).isEmpty();
        assertThat(response.rawText()).isEqualTo(TEXT.text());
        assertThat(response.confidence()).isEqualTo(0.8);
        Receipt receipt = response.receipt();
        assertThat(receipt.store().name()).isEqualTo("SUPERMART");
        assertThat(receipt.items()).extracting(ReceiptItem::name).containsExactly("Milk", "Bread");
        assertThat(receipt.items()).extracting(ReceiptItem::confidence).containsExactly(0.7, 0.6);
        assertThat(receipt.totals().total()).isEqualByComparingTo("5.94");
    }

    @Test
    void recomputesTotalsFromItemsWhenTotalsBlockIsMissing() {
        ExtractedReceipt extracted = extracted(STORE, null, items(), ExtractedTotals.EMPTY);

        ReceiptParsingResponse response = assembler.assemble(TEXT, extracted, report(0.8));

        assertThat(response.success()).isTrue();
        Receipt receipt = response.receipt();
        assertThat(receipt.totals().subtotal()).isEqualByComparingTo("5.50");
        assertThat(receipt.totals().tax()).isEqualByComparingTo("0.00");
        assertThat(receipt.totals().total()).isEqualByComparingTo("5.50");
        assertThat(receipt.confidence()).isCloseTo(0.64, within(1e-9));
        assertThat(response.errors())
            .containsExactly("Totals not found; subtotal and total recomputed from item prices with tax 0.00");
    }

    @Test
    void derivesSubtotalFromTotalTaxAndDiscount() {
        ExtractedTotals totals = new ExtractedTotals(null, amount("0.50"), amount("5.00"), null, amount("1.00"));

        ReceiptParsingResponse response = assembler.assemble(TEXT, extracted(STORE, null, items(), totals),
            report(0.8));

        assertThat(response.receipt().totals().subtotal()).isEqualByComparingTo("5.50");
        assertThat(response.errors()).containsExactly("Subtotal derived from total, tax and discount");
    }

    @Test
    void assumesZeroTaxAndDerivesTotal() {
        ExtractedTotals totals = new ExtractedTotals(amount("5.50"), null, null, null, null);

        ReceiptParsingResponse response = assembler.assemble(TEXT, extracted(STORE, null, items(), totals),
            report(0.8));

        assertThat(response.receipt().totals().tax()).isEqualByComparingTo("0.00");
        assertThat(response.receipt().totals().total()).isEqualByComparingTo("5.50");
        assertThat(response.errors())
            .containsExactly("Tax not found; assumed 0.00", "Total derived from subtotal, tax and discount");
    }

    @Test
    void failsWithoutItemsAndKeepsPartialExtraction() {
        ExtractedReceipt extracted = extracted(STORE, null, List.of(), totals("5.50", "0.44", "5.94"));

        ReceiptParsingResponse response = assembler.assemble(TEXT, extracted, report(0.4));

        assertThat(response.success()).isFalse();
        assertThat(response.data()).isSameAs(extracted);
        assertThat(response.receipt()).isNull();
        assertThat(response.confidence()).isEqualTo(0.4);
        assertThat(response.errors()).containsExactly(ReceiptAssembler.NO_ITEMS);
    }

    @Test
    void reportsMissingTotalAlongsideMissingItems() {
        ExtractedReceipt extracted = extracted(null, null, List.of(), ExtractedTotals.EMPTY);

        ReceiptParsingResponse response = assembler.assemble(new SanitizedText("", List.of()), extracted,
            report(0.0));

        assertThat(response.success()).isFalse();
        assertThat(response.errors()).containsExactly(ReceiptAssembler.NO_ITEMS, ReceiptAssembler.NO_TOTAL);
    }

    @Test
    void failsWhenTotalIsNotPositive() {
        ReceiptParsingResponse response = assembler.assemble(TEXT,
            extracted(STORE, null, items(), totals("5.50", "0.00", "0.00")), report(0.8));

        assertThat(response.success()).isFalse();
        assertThat(response.errors()).startsWith(ReceiptAssembler.NON_POSITIVE_TOTAL);
    }

    @Test
    void namesUnknownStoreAndFlagsFutureDates() {
        ExtractedField<LocalDate> date = new ExtractedField<>(LocalDate.of(2024, 6, 2), 0.9, FieldSource.GENERIC);

        ReceiptParsingResponse response = assembler.assemble(TEXT,
            extracted(null, date, items(), totals("5.50", "0.44", "5.94")), report(0.8));

        assertThat(response.success()).isTrue();
        assertThat(response.receipt().store().name()).isEqualTo(ReceiptAssembler.UNKNOWN_STORE);
        assertThat(response.receipt().date()).isEqualTo(LocalDate.of(2024, 6, 2));
        assertThat(response.errors()).containsExactly("Store name not found", "Receipt date 2024-06-02 is in the future");
    }

    @Test
    void carriesSanitizerAndScorerWarnings() {
        SanitizedText text = new SanitizedText(TEXT.text(), List.of("Removed 3 control characters"));
        ConfidenceReport report = new ConfidenceReport(0.5, 0.9, 0.7, List.of(0.7, 0.6), Reconciliation.NOT_CHECKED,
            List.of("Totals do not reconcile"));

        ReceiptParsingResponse response = assembler.assemble(text,
            extracted(STORE, null, items(), totals("5.50", "0.44", "5.94")), report);

        assertThat(response.errors()).containsExactly("Removed 3 control characters", "Totals do not reconcile");
    }

    private static ConfidenceReport report(double confidence) {
        return new ConfidenceReport(confidence, 0.9, 0.7, List.of(0.7, 0.6), Reconciliation.NOT_CHECKED, List.of());
    }

    private static ExtractedReceipt extracted(ExtractedField<Store> store, ExtractedField<LocalDate> date,
        List<ExtractedItem> items, ExtractedTotals totals) {
        return new ExtractedReceipt("supermart", store, date, items, totals, null, List.of());
    }

    private static List<ExtractedItem> items() {
        return List.of(item("Milk", "3.50", 1), item("Bread", "2.00", 2));
    }

    private static ExtractedItem item(String name, String price, int lineIndex) {
        return new ExtractedItem(
            new ExtractedField<>(name, 0.7, FieldSource.GENERIC),
            new ExtractedField<>(new BigDecimal(price), 0.7, FieldSource.GENERIC),
            new ExtractedField<>(1, 0.56, FieldSource.DEFAULT),
            null,
            null,
            null,
            lineIndex);
    }

    private static ExtractedTotals totals(String subtotal, String tax, String total) {
        return new ExtractedTotals(amount(subtotal), amount(tax), amount(total), null, null);
    }

    private static ExtractedField<BigDecimal> amount(String value) {
        return new ExtractedField<>(new BigDecimal(value), 0.7, FieldSource.GENERIC);
    }
}
