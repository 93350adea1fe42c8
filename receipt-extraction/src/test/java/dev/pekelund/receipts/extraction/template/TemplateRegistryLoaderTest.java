package dev.pekelund.receipts.extraction.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.receipts.extraction.extract.ExtractedReceipt;
import dev.pekelund.receipts.extraction.extract.FieldConfidencePolicy;
import dev.pekelund.receipts.extraction.extract.FieldSource;
import dev.pekelund.receipts.extraction.extract.RegionConfidence;
import dev.pekelund.receipts.extraction.sanitize.SanitizedText;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

class TemplateRegistryLoaderTest {

    private final TemplateRegistryLoader loader =
        new TemplateRegistryLoader(new ObjectMapper(), FieldConfidencePolicy.DEFAULTS);

    @Test
    void loadsBuiltInTemplatesInDeclarationOrder() {
        TemplateRegistry registry = loader.load(new ClassPathResource("receipt-templates.json"));

        assertThat(registry.templates()).extracting(ReceiptTemplate::id)
            .containsExactly("supermart", "walmart", "target", "costco", "kroger", "starbucks", "amazon");
    }

    @Test
    void everyBuiltInTemplateIsSelectedByItsMerchantNameAlone() {
        TemplateRegistry registry = loader.load(new ClassPathResource("receipt-templates.json"));
        TemplateDetector detector = new TemplateDetector(registry, TemplateDetector.DEFAULT_ACCEPTANCE_THRESHOLD);

        for (ReceiptTemplate template : registry.templates()) {
            String merchant = template.anchors().get(0).token();
            TemplateMatch match = detector.detect(new SanitizedText(merchant + "\nTOTAL 1.00", List.of()));
            assertThat(match.templateId()).as(merchant).isEqualTo(template.id());
        }
    }

    @Test
    void itemPatternsUseTheSharedAmountExpression() {
        TemplateRegistry registry = loader.load(new ClassPathResource("receipt-templates.json"));
        ReceiptTemplate walmart = registry.find("walmart").orElseThrow();

        ExtractedReceipt extracted = walmart.extractor().extract(new SanitizedText(
            "Walmart\nGV WHOLE MILK 007874235 F 3.48 N\nSUBTOTAL 3.48\nTOTAL 3.48", List.of()), RegionConfidence.NONE);

        assertThat(extracted.items()).hasSize(1);
        assertThat(extracted.items().get(0).name().value()).isEqualTo("GV WHOLE MILK");
        assertThat(extracted.items().get(0).price().value()).isEqualByComparingTo(new BigDecimal("3.48"));
        assertThat(extracted.items().get(0).price().source()).isEqualTo(FieldSource.TEMPLATE);
        assertThat(extracted.store().value().name()).isEqualTo("Walmart");
    }

    @Test
    void templateDatePatternsAreTriedFirst() {
        TemplateRegistry registry = loader.load(new ClassPathResource("receipt-templates.json"));
        ReceiptTemplate amazon = registry.find("amazon").orElseThrow();

        ExtractedReceipt extracted = amazon.extractor().extract(new SanitizedText(
            "Amazon.com\nOrder Placed: March 4, 2024\n1 of: USB Cable 9.99\nGrand Total: 9.99", List.of()),
            RegionConfidence.NONE);

        assertThat(extracted.date().value()).isEqualTo(LocalDate.of(2024, 3, 4));
        assertThat(extracted.date().source()).isEqualTo(FieldSource.TEMPLATE);
        assertThat(extracted.totals().total().source()).isEqualTo(FieldSource.TEMPLATE);
    }

    @Test
    void rejectsInvalidRegularExpressions() {
        String json = """
            {"templates": [{"id": "broken", "anchors": [{"token": "broken", "weight": 1}],
              "itemPatterns": ["(?<name>.*(?<amount>{amount}"]}]}
            """;

        assertThatThrownBy(() -> loader.load(resource(json)))
            .isInstanceOf(TemplateDefinitionException.class)
            .hasMessageContaining("invalid pattern");
    }

    @Test
    void rejectsItemPatternsWithoutRequiredGroups() {
        String json = """
            {"templates": [{"id": "shop", "anchors": [{"token": "shop", "weight": 1}],
              "itemPatterns": ["(?<name>.+) {amount}"]}]}
            """;

        assertThatThrownBy(() -> loader.load(resource(json)))
            .isInstanceOf(TemplateDefinitionException.class)
            .hasMessageContaining("'name' and 'amount'");
    }

    @Test
    void rejectsNonPositiveAnchorWeights() {
        String json = """
            {"templates": [{"id": "shop", "anchors": [{"token": "shop", "weight": 0}]}]}
            """;

        assertThatThrownBy(() -> loader.load(resource(json)))
            .isInstanceOf(TemplateDefinitionException.class)
            .hasMessageContaining("non-positive weight");
    }

    @Test
    void rejectsDuplicateTemplateIds() {
        String json = """
            {"templates": [
              {"id": "shop", "anchors": [{"token": "shop", "weight": 1}]},
              {"id": "Shop", "anchors": [{"token": "store", "weight": 1}]}]}
            """;

        assertThatThrownBy(() -> loader.load(resource(json)))
            .isInstanceOf(TemplateDefinitionException.class)
            .hasMessageContaining("Duplicate template id");
    }

    @Test
    void rejectsUnknownTotalsFields() {
        String json = """
            {"templates": [{"id": "shop", "anchors": [{"token": "shop", "weight": 1}],
              "totalsKeywords": {"GRAND": "grand"}}]}
            """;

        assertThatThrownBy(() -> loader.load(resource(json)))
            .isInstanceOf(TemplateDefinitionException.class)
            .hasMessageContaining("unknown totals field");
    }

    @Test
    void reportsMissingOrUnreadableResources() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("missing-templates.json")))
            .isInstanceOf(TemplateDefinitionException.class)
            .hasMessageContaining("does not exist");
        assertThatThrownBy(() -> loader.load(resource("{not json")))
            .isInstanceOf(TemplateDefinitionException.class)
            .hasMessageContaining("Failed to read");
    }

    private static ByteArrayResource resource(String json) {
        return new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8));
    }
}
