package dev.pekelund.receipts.extraction.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.pekelund.receipts.extraction.ocr.OcrRegion;
import dev.pekelund.receipts.extraction.sanitize.SanitizedText;
import dev.pekelund.receipts.model.PaymentInfo;
import dev.pekelund.receipts.model.PaymentMethod;
import dev.pekelund.receipts.model.Store;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class GenericFieldExtractorTest {

    private final GenericFieldExtractor extractor = new GenericFieldExtractor(FieldConfidencePolicy.DEFAULTS);

    @Test
    void extractsStoreItemsAndTotalsFromSimpleReceipt() {
        ExtractedReceipt receipt = extract("SUPERMART\n2 x Milk 3.50\nBread 2.00\nSUBTOTAL 9.00\nTAX 0.72\nTOTAL 9.72");

        assertThat(receipt.templateId()).isEqualTo("generic");
        assertThat(receipt.store().value().name()).isEqualTo("SUPERMART");
        assertThat(receipt.store().source()).isEqualTo(FieldSource.GENERIC);
        assertThat(receipt.store().confidence()).isEqualTo(0.7);

        assertThat(receipt.items()).hasSize(2);
        ExtractedItem milk = receipt.items().get(0);
        assertThat(milk.name().value()).isEqualTo("Milk");
        assertThat(milk.quantity().value()).isEqualTo(2);
        assertThat(milk.quantity().source()).isEqualTo(FieldSource.GENERIC);
        assertThat(milk.price().value()).isEqualByComparingTo("3.50");
        assertThat(milk.unitPrice().value()).isEqualByComparingTo("1.75");
        assertThat(milk.category()).isEqualTo("Dairy");
        assertThat(milk.lineIndex()).isEqualTo(1);

        ExtractedItem bread = receipt.items().get(1);
        assertThat(bread.name().value()).isEqualTo("Bread");
        assertThat(bread.price().value()).isEqualByComparingTo("2.00");
        assertThat(bread.quantity().value()).isEqualTo(1);
        assertThat(bread.quantity().source()).isEqualTo(FieldSource.DEFAULT);
        assertThat(bread.quantity().confidence()).isCloseTo(0.56, within(1e-9));
        assertThat(bread.unitPrice()).isNull();
        assertThat(bread.category()).isEqualTo("Bakery");

        assertThat(receipt.totals().subtotal().value()).isEqualByComparingTo("9.00");
        assertThat(receipt.totals().tax().value()).isEqualByComparingTo("0.72");
        assertThat(receipt.totals().total().value()).isEqualByComparingTo("9.72");
        assertThat(receipt.totals().tip()).isNull();
        assertThat(receipt.totals().discount()).isNull();
        assertThat(receipt.warnings()).isEmpty();
    }

    @Test
    void readsExplicitUnitPriceLines() {
        ExtractedReceipt receipt = extract("Farm Stand\nApples 3 @ 0.50 1.50\nTOTAL 1.50");

        ExtractedItem apples = receipt.items().get(0);
        assertThat(apples.name().value()).isEqualTo("Apples");
        assertThat(apples.quantity().value()).isEqualTo(3);
        assertThat(apples.unitPrice().value()).isEqualByComparingTo("0.50");
        assertThat(apples.price().value()).isEqualByComparingTo("1.50");
        assertThat(apples.category()).isEqualTo("Produce");
    }

    @Test
    void acceptsOcrNoiseInTotalsKeywordsWithReducedConfidence() {
        ExtractedReceipt receipt = extract("Corner Shop\nSoap 5.00\nT0TAL 5.00");

        ExtractedField<BigDecimal> total = receipt.totals().total();
        assertThat(total.value()).isEqualByComparingTo("5.00");
        assertThat(total.confidence()).isCloseTo(0.63, within(1e-9));
        assertThat(receipt.items()).extracting(item -> item.name().value()).containsExactly("Soap");
    }

    @Test
    void readsTotalAmountPrintedOnFollowingLine() {
        ExtractedReceipt receipt = extract("Corner Shop\nSoap 5.00\nTOTAL\n5.00");

        assertThat(receipt.totals().total().value()).isEqualByComparingTo("5.00");
        assertThat(receipt.items()).hasSize(1);
    }

    @Test
    void stopsReadingItemsAtTotalsBlock() {
        ExtractedReceipt receipt = extract("Corner Shop\nSoap 5.00\nTOTAL 5.00\nCASH 10.00\nCHANGE 5.00\nSurvey code 12.34");

        assertThat(receipt.items()).extracting(item -> item.name().value()).containsExactly("Soap");
    }

    @Test
    void turnsNegativeItemLinesIntoDiscount() {
        ExtractedReceipt receipt = extract("Corner Shop\nSoap 5.00\nPrice Adj -1.00\nTOTAL 4.00");

        assertThat(receipt.items()).hasSize(1);
        assertThat(receipt.totals().discount().value()).isEqualByComparingTo("1.00");
        assertThat(receipt.totals().discount().confidence()).isEqualTo(0.5);
        assertThat(receipt.warnings()).containsExactly("Discount derived from negative item lines");
    }

    @Test
    void readsDiscountKeywordAsPositiveAmount() {
        ExtractedReceipt receipt = extract("Corner Shop\nSoap 5.00\nSUBTOTAL 5.00\nCOUPON -1.00\nTOTAL 4.00");

        assertThat(receipt.totals().discount().value()).isEqualByComparingTo("1.00");
        assertThat(receipt.warnings()).isEmpty();
    }

    @Test
    void extractsStoreContactDetails() {
        ExtractedReceipt receipt = extract("""
            SUPERMART
            123 Main Street
            Tel: (555) 123-4567
            www.supermart.com
            Bread 2.00
            TOTAL 2.00""");

        Store store = receipt.store().value();
        assertThat(store.name()).isEqualTo("SUPERMART");
        assertThat(store.address()).isEqualTo("123 Main Street");
        assertThat(store.phone()).isEqualTo("(555) 123-4567");
        assertThat(store.website()).isEqualTo("www.supermart.com");
    }

    @Test
    void extractsDateAndPayment() {
        ExtractedReceipt receipt = extract("""
            Corner Shop
            03/15/2024 14:32
            Soap 5.00
            TOTAL 5.00
            VISA ****1234
            Trans ID: 98765""");

        assertThat(receipt.date().value()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(receipt.date().source()).isEqualTo(FieldSource.GENERIC);

        PaymentInfo payment = receipt.payment().value();
        assertThat(payment.method()).isEqualTo(PaymentMethod.CREDIT);
        assertThat(payment.cardType()).isEqualTo("VISA");
        assertThat(payment.cardLast4()).isEqualTo("1234");
        assertThat(payment.transactionId()).isEqualTo("98765");
    }

    @Test
    void prefersIsoDatesAndReadsDayFirstDottedDates() {
        assertThat(extract("Shop\n2024-01-31\nSoap 5.00").date().value()).isEqualTo(LocalDate.of(2024, 1, 31));
        assertThat(extract("Shop\n15.03.2024\nSoap 5.00").date().value()).isEqualTo(LocalDate.of(2024, 3, 15));
        assertThat(extract("Shop\nMar 4, 2024\nSoap 5.00").date().value()).isEqualTo(LocalDate.of(2024, 3, 4));
    }

    @Test
    void returnsEmptyExtractionForEmptyText() {
        ExtractedReceipt receipt = extract("");

        assertThat(receipt.store()).isNull();
        assertThat(receipt.date()).isNull();
        assertThat(receipt.payment()).isNull();
        assertThat(receipt.items()).isEmpty();
        assertThat(receipt.totals().isBlockAbsent()).isTrue();
    }

    @Test
    void blendsOcrRegionConfidenceIntoFieldConfidence() {
        SanitizedText text = new SanitizedText("Corner Shop\nSoap 5.00\nTOTAL 5.00", List.of());
        RegionConfidence regions = RegionConfidence.from(List.of(
            new OcrRegion("Corner Shop", 0.9, null),
            new OcrRegion("Soap 5.00\nTOTAL 5.00", 0.5, null)));

        ExtractedReceipt receipt = extractor.extract(text, regions);

        assertThat(receipt.totals().total().confidence()).isCloseTo(0.6, within(1e-9));
        assertThat(receipt.store().confidence()).isCloseTo(0.8, within(1e-9));
        assertThat(allConfidences(receipt)).allSatisfy(confidence -> assertThat(confidence).isBetween(0.0, 1.0));
    }

    private ExtractedReceipt extract(String text) {
        return extractor.extract(new SanitizedText(text, List.of()), RegionConfidence.NONE);
    }

    private static List<Double> allConfidences(ExtractedReceipt receipt) {
        Stream<ExtractedField<?>> itemFields = receipt.items().stream()
            .flatMap(item -> Stream.of(item.name(), item.price(), item.quantity()));
        Stream<ExtractedField<?>> others = Stream.of(receipt.store(), receipt.date(), receipt.payment(),
            receipt.totals().subtotal(), receipt.totals().tax(), receipt.totals().total());
        return Stream.concat(itemFields, others)
            .filter(field -> field != null)
            .map(ExtractedField::confidence)
            .toList();
    }
}
