package dev.pekelund.receipts.extraction.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.receipts.extraction.assembly.ReceiptAssembler;
import dev.pekelund.receipts.extraction.assembly.ReceiptParsingResponse;
import dev.pekelund.receipts.extraction.extract.ExtractedReceipt;
import dev.pekelund.receipts.extraction.extract.FieldConfidencePolicy;
import dev.pekelund.receipts.extraction.ocr.OcrRegion;
import dev.pekelund.receipts.extraction.ocr.RawOcrResult;
import dev.pekelund.receipts.extraction.sanitize.JsoupMarkupStripper;
import dev.pekelund.receipts.extraction.sanitize.ReceiptTextSanitizer;
import dev.pekelund.receipts.extraction.sanitize.SanitizationException;
import dev.pekelund.receipts.extraction.scoring.ConfidenceScorer;
import dev.pekelund.receipts.extraction.scoring.ScoringWeights;
import dev.pekelund.receipts.extraction.template.TemplateDetector;
import dev.pekelund.receipts.extraction.template.TemplateRegistry;
import dev.pekelund.receipts.extraction.template.TemplateRegistryLoader;
import dev.pekelund.receipts.model.Receipt;
import dev.pekelund.receipts.model.ReceiptItem;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.core.io.ClassPathResource;

class ReceiptParsingPipelineTest {

    private static final String SUPERMART_RECEIPT =
        "SUPERMART\n2 x Milk 3.50\nBread 2.00\nSUBTOTAL 9.00\nTAX 0.72\nTOTAL 9.72";

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final ReceiptParsingPipeline pipeline = pipeline();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void parsesReceiptWithRegisteredTemplate() {
        ReceiptParsingResponse response = pipeline.process(RawOcrResult.textOnly(SUPERMART_RECEIPT));

        assertThat(response.success()).isTrue();
        assertThat(response.errors()).isEmpty();
        assertThat(response.rawText()).isEqualTo(SUPERMART_RECEIPT);

        Receipt receipt = response.receipt();
        assertThat(receipt.store().name()).isEqualTo("SUPERMART");
        assertThat(receipt.items()).hasSize(2);
        ReceiptItem milk = receipt.items().get(0);
        assertThat(milk.name()).isEqualTo("Milk");
        assertThat(milk.quantity()).isEqualTo(2);
        assertThat(milk.unitPrice()).isEqualByComparingTo("1.75");
        assertThat(milk.price()).isEqualByComparingTo("3.50");
        ReceiptItem bread = receipt.items().get(1);
        assertThat(bread.name()).isEqualTo("Bread");
        assertThat(bread.quantity()).isEqualTo(1);
        assertThat(bread.price()).isEqualByComparingTo("2.00");
        assertThat(receipt.totals().subtotal()).isEqualByComparingTo("9.00");
        assertThat(receipt.totals().tax()).isEqualByComparingTo("0.72");
        assertThat(receipt.totals().total()).isEqualByComparingTo("9.72");
        assertThat(response.confidence()).isBetween(0.0, 1.0);

        assertThat(MDC.get(ReceiptProcessingMdc.KEY_TEMPLATE)).isEqualTo("supermart");
        assertThat(MDC.get(ReceiptProcessingMdc.KEY_STAGE)).isEqualTo("assembled");
    }

    @Test
    void warnsAndLowersConfidenceWhenTotalsDoNotReconcile() {
        ReceiptParsingResponse balanced = pipeline.process(RawOcrResult.textOnly(SUPERMART_RECEIPT));
        ReceiptParsingResponse mismatched = pipeline.process(
            RawOcrResult.textOnly(SUPERMART_RECEIPT.replace("TOTAL 9.72", "TOTAL 10.00")));

        assertThat(mismatched.success()).isTrue();
        assertThat(mismatched.errors()).anySatisfy(error -> assertThat(error).startsWith("Totals do not reconcile"));
        assertThat(mismatched.confidence()).isLessThan(balanced.confidence());
    }

    @Test
    void failsOnEmptyText() {
        ReceiptParsingResponse response = pipeline.process(RawOcrResult.textOnly(""));

        assertThat(response.success()).isFalse();
        assertThat(response.errors()).contains("No items found in receipt", "Receipt total amount is missing");
    }

    @Test
    void stripsScriptsBeforeExtraction() throws Exception {
        ReceiptParsingResponse response = pipeline.process(
            RawOcrResult.textOnly("<script>alert(1)</script>TOTAL 5.00"));

        assertThat(response.data()).isInstanceOfSatisfying(ExtractedReceipt.class,
            extracted -> assertThat(extracted.totals().total().value()).isEqualByComparingTo("5.00"));
        assertThat(response.rawText()).isEqualTo("TOTAL 5.00");
        String json = objectMapper.writeValueAsString(response);
        assertThat(json).doesNotContain("<", "script", "alert");
    }

    @Test
    void blendsOcrRegionConfidence() {
        ReceiptParsingResponse textOnly = pipeline.process(RawOcrResult.textOnly(SUPERMART_RECEIPT));
        ReceiptParsingResponse blurry = pipeline.process(new RawOcrResult(SUPERMART_RECEIPT,
            List.of(new OcrRegion(SUPERMART_RECEIPT, 0.2, null)), "en"));

        assertThat(blurry.success()).isTrue();
        assertThat(blurry.confidence()).isLessThan(textOnly.confidence());
    }

    @Test
    void processesPlainTextWithoutOcr() {
        ReceiptParsingResponse response = pipeline.processText(SUPERMART_RECEIPT.getBytes(StandardCharsets.UTF_8));

        assertThat(response.success()).isTrue();
        assertThat(response.receipt().store().name()).isEqualTo("SUPERMART");
    }

    @Test
    void fallsBackToGenericExtractionForUnknownMerchants() {
        ReceiptParsingResponse response = pipeline.process(
            RawOcrResult.textOnly("Corner Bakery\nBagel 2.50\nTOTAL 2.50"));

        assertThat(response.success()).isTrue();
        assertThat(response.receipt().store().name()).isEqualTo("Corner Bakery");
        assertThat(MDC.get(ReceiptProcessingMdc.KEY_TEMPLATE)).isEqualTo("generic");
    }

    @Test
    void rejectsMalformedUtf8() {
        byte[] invalid = {(byte) 0xC3, (byte) 0x28};

        assertThatThrownBy(() -> pipeline.processText(invalid)).isInstanceOf(SanitizationException.class);
    }

    private static ReceiptParsingPipeline pipeline() {
        FieldConfidencePolicy policy = FieldConfidencePolicy.DEFAULTS;
        TemplateRegistry registry = new TemplateRegistryLoader(new ObjectMapper(), policy)
            .load(new ClassPathResource("receipt-templates.json"));
        Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        return new ReceiptParsingPipeline(
            new ReceiptTextSanitizer(new JsoupMarkupStripper(), ReceiptTextSanitizer.DEFAULT_MAX_LENGTH),
            new TemplateDetector(registry, TemplateDetector.DEFAULT_ACCEPTANCE_THRESHOLD),
            new ConfidenceScorer(ScoringWeights.DEFAULTS),
            new ReceiptAssembler(clock, ScoringWeights.DEFAULTS.missingTotalsPenalty()));
    }
}
