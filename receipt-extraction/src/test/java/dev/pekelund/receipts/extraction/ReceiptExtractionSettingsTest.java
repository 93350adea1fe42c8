package dev.pekelund.receipts.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.receipts.extraction.extract.FieldConfidencePolicy;
import dev.pekelund.receipts.extraction.ocr.VisionRetrySettings;
import dev.pekelund.receipts.extraction.scoring.ScoringWeights;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class ReceiptExtractionSettingsTest {

    @Test
    void fallsBackToDefaults() {
        ReceiptExtractionSettings settings = ReceiptExtractionSettings.fromEnvironment(new MockEnvironment());

        assertThat(settings.sanitizerMaxLength()).isEqualTo(20_000);
        assertThat(settings.templatesLocation()).isEqualTo(ReceiptExtractionSettings.DEFAULT_TEMPLATES_LOCATION);
        assertThat(settings.acceptanceThreshold()).isEqualTo(0.5);
        assertThat(settings.visionRetry()).isEqualTo(VisionRetrySettings.DEFAULTS);
        assertThat(settings.languageHints()).containsExactly("en");
        assertThat(settings.confidencePolicy()).isEqualTo(FieldConfidencePolicy.DEFAULTS);
        assertThat(settings.scoringWeights()).isEqualTo(ScoringWeights.DEFAULTS);
        assertThat(settings.persistenceEnabled()).isFalse();
        assertThat(settings.persistenceCollection()).isEqualTo("receipts");
        assertThat(settings.projectId()).isNull();
    }

    @Test
    void readsOverrides() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("receipts.templates.acceptance-threshold", "0.7")
            .withProperty("receipts.vision.max-attempts", "5")
            .withProperty("receipts.vision.initial-backoff", "1s")
            .withProperty("receipts.vision.max-backoff", "PT10S")
            .withProperty("receipts.vision.language-hints", "sv, en")
            .withProperty("receipts.extraction.ocr-weight", "0")
            .withProperty("receipts.scoring.reconciliation-tolerance", "0.05")
            .withProperty("receipts.persistence.enabled", "true")
            .withProperty("receipts.persistence.collection", "parsedReceipts")
            .withProperty("GOOGLE_CLOUD_PROJECT", "receipts-prod");

        ReceiptExtractionSettings settings = ReceiptExtractionSettings.fromEnvironment(environment);

        assertThat(settings.acceptanceThreshold()).isEqualTo(0.7);
        assertThat(settings.visionRetry().maxAttempts()).isEqualTo(5);
        assertThat(settings.visionRetry().initialBackoff()).isEqualTo(Duration.ofSeconds(1));
        assertThat(settings.visionRetry().maxBackoff()).isEqualTo(Duration.ofSeconds(10));
        assertThat(settings.languageHints()).containsExactly("sv", "en");
        assertThat(settings.confidencePolicy().ocrWeight()).isZero();
        assertThat(settings.scoringWeights().reconciliationTolerance()).isEqualByComparingTo("0.05");
        assertThat(settings.persistenceEnabled()).isTrue();
        assertThat(settings.persistenceCollection()).isEqualTo("parsedReceipts");
        assertThat(settings.projectId()).isEqualTo("receipts-prod");
    }

    @Test
    void prefersExplicitProjectId() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("receipts.persistence.project-id", "explicit")
            .withProperty("GCP_PROJECT", "legacy");

        assertThat(ReceiptExtractionSettings.fromEnvironment(environment).projectId()).isEqualTo("explicit");
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("receipts.templates.acceptance-threshold", "0");

        assertThatThrownBy(() -> ReceiptExtractionSettings.fromEnvironment(environment))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("receipts.templates.acceptance-threshold");
    }

    @Test
    void rejectsMaxBackoffShorterThanInitialBackoff() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("receipts.vision.initial-backoff", "5s")
            .withProperty("receipts.vision.max-backoff", "1s");

        assertThatThrownBy(() -> ReceiptExtractionSettings.fromEnvironment(environment))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("max-backoff");
    }

    @Test
    void rejectsUnparseableDuration() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("receipts.vision.initial-backoff", "soon");

        assertThatThrownBy(() -> ReceiptExtractionSettings.fromEnvironment(environment))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("receipts.vision.initial-backoff is not a valid duration: soon");
    }

    @Test
    void rejectsBlankCollectionWhenPersistenceIsEnabled() {
        MockEnvironment environment = new MockEnvironment()
            .withProperty("receipts.persistence.enabled", "true")
            .withProperty("receipts.persistence.collection", " ");

        assertThatThrownBy(() -> ReceiptExtractionSettings.fromEnvironment(environment))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNonPositiveSanitizerLength() {
        MockEnvironment environment = new MockEnvironment().withProperty("receipts.sanitizer.max-length", "0");

        assertThatThrownBy(() -> ReceiptExtractionSettings.fromEnvironment(environment))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("max-length");
    }
}
