package dev.pekelund.receipts.extraction;

import dev.pekelund.receipts.extraction.extract.FieldConfidencePolicy;
import dev.pekelund.receipts.extraction.ocr.VisionRetrySettings;
import dev.pekelund.receipts.extraction.sanitize.ReceiptTextSanitizer;
import dev.pekelund.receipts.extraction.scoring.ScoringWeights;
import dev.pekelund.receipts.extraction.template.TemplateDetector;
import dev.pekelund.receipts.model.ReceiptCollections;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.core.env.PropertyResolver;
import org.springframework.util.StringUtils;

/**
 * Configuration values resolved once at startup for the receipt extraction service.
 */
public record ReceiptExtractionSettings(
    int sanitizerMaxLength,
    String templatesLocation,
    double acceptanceThreshold,
    VisionRetrySettings visionRetry,
    List<String> languageHints,
    FieldConfidencePolicy confidencePolicy,
    ScoringWeights scoringWeights,
    boolean persistenceEnabled,
    String persistenceCollection,
    String projectId
) {

    static final String DEFAULT_TEMPLATES_LOCATION = "classpath:receipt-templates.json";

    public ReceiptExtractionSettings {
        languageHints = languageHints == null ? List.of() : List.copyOf(languageHints);
    }

    public static ReceiptExtractionSettings fromEnvironment(PropertyResolver environment) {
        Objects.requireNonNull(environment, "environment");

        int maxLength = environment.getProperty("receipts.sanitizer.max-length", Integer.class,
            ReceiptTextSanitizer.DEFAULT_MAX_LENGTH);
        if (maxLength < 1) {
            throw new IllegalStateException("receipts.sanitizer.max-length must be positive but was " + maxLength);
        }

        String templatesLocation = environment.getProperty("receipts.templates.location", DEFAULT_TEMPLATES_LOCATION);
        if (!StringUtils.hasText(templatesLocation)) {
            throw new IllegalStateException("receipts.templates.location must not be blank");
        }
        double threshold = unitInterval(environment, "receipts.templates.acceptance-threshold",
            TemplateDetector.DEFAULT_ACCEPTANCE_THRESHOLD);

        VisionRetrySettings visionRetry = visionRetry(environment);
        List<String> languageHints = Arrays.stream(StringUtils.commaDelimitedListToStringArray(
                environment.getProperty("receipts.vision.language-hints", "en")))
            .map(String::trim)
            .filter(StringUtils::hasText)
            .toList();

        FieldConfidencePolicy defaults = FieldConfidencePolicy.DEFAULTS;
        FieldConfidencePolicy confidencePolicy = new FieldConfidencePolicy(
            unitInterval(environment, "receipts.extraction.template-pattern-confidence",
                defaults.templatePatternConfidence()),
            unitInterval(environment, "receipts.extraction.generic-pattern-confidence",
                defaults.genericPatternConfidence()),
            unitInterval(environment, "receipts.extraction.heuristic-confidence", defaults.heuristicConfidence()),
            unitInterval(environment, "receipts.extraction.default-value-penalty", defaults.defaultValuePenalty()),
            fraction(environment, "receipts.extraction.ocr-weight", defaults.ocrWeight()));

        ScoringWeights scoringWeights = scoringWeights(environment);

        boolean persistenceEnabled = environment.getProperty("receipts.persistence.enabled", Boolean.class, false);
        String collection = environment.getProperty("receipts.persistence.collection",
            ReceiptCollections.DEFAULT_RECEIPTS_COLLECTION);
        if (persistenceEnabled && !StringUtils.hasText(collection)) {
            throw new IllegalStateException("receipts.persistence.collection must not be blank when persistence is enabled");
        }
        String projectId = firstNonEmpty(
            environment.getProperty("receipts.persistence.project-id"),
            environment.getProperty("GOOGLE_CLOUD_PROJECT"),
            environment.getProperty("GCP_PROJECT"));

        return new ReceiptExtractionSettings(maxLength, templatesLocation.trim(), threshold, visionRetry,
            languageHints, confidencePolicy, scoringWeights, persistenceEnabled, collection, projectId);
    }

    private static VisionRetrySettings visionRetry(PropertyResolver environment) {
        VisionRetrySettings defaults = VisionRetrySettings.DEFAULTS;
        int maxAttempts = environment.getProperty("receipts.vision.max-attempts", Integer.class,
            defaults.maxAttempts());
        if (maxAttempts < 1) {
            throw new IllegalStateException("receipts.vision.max-attempts must be at least 1 but was " + maxAttempts);
        }
        double multiplier = environment.getProperty("receipts.vision.backoff-multiplier", Double.class,
            defaults.backoffMultiplier());
        if (multiplier < 1.0) {
            throw new IllegalStateException("receipts.vision.backoff-multiplier must be at least 1.0 but was "
                + multiplier);
        }
        Duration initialBackoff = duration(environment, "receipts.vision.initial-backoff", defaults.initialBackoff());
        Duration maxBackoff = duration(environment, "receipts.vision.max-backoff", defaults.maxBackoff());
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalStateException("receipts.vision.max-backoff must not be shorter than initial-backoff");
        }
        return new VisionRetrySettings(maxAttempts, initialBackoff, multiplier, maxBackoff);
    }

    private static ScoringWeights scoringWeights(PropertyResolver environment) {
        ScoringWeights defaults = ScoringWeights.DEFAULTS;
        double storeWeight = nonNegative(environment, "receipts.scoring.store-weight", defaults.storeWeight());
        double totalsWeight = nonNegative(environment, "receipts.scoring.totals-weight", defaults.totalsWeight());
        BigDecimal tolerance = environment.getProperty("receipts.scoring.reconciliation-tolerance", BigDecimal.class,
            defaults.reconciliationTolerance());
        if (tolerance.signum() < 0) {
            throw new IllegalStateException("receipts.scoring.reconciliation-tolerance must not be negative");
        }
        return new ScoringWeights(storeWeight, totalsWeight, tolerance,
            unitInterval(environment, "receipts.scoring.mismatch-penalty", defaults.mismatchPenalty()),
            unitInterval(environment, "receipts.scoring.missing-totals-penalty", defaults.missingTotalsPenalty()));
    }

    private static double unitInterval(PropertyResolver environment, String key, double defaultValue) {
        double value = environment.getProperty(key, Double.class, defaultValue);
        if (!(value > 0.0 && value <= 1.0)) {
            throw new IllegalStateException(key + " must be within (0, 1] but was " + value);
        }
        return value;
    }

    private static double fraction(PropertyResolver environment, String key, double defaultValue) {
        double value = environment.getProperty(key, Double.class, defaultValue);
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalStateException(key + " must be within [0, 1] but was " + value);
        }
        return value;
    }

    private static double nonNegative(PropertyResolver environment, String key, double defaultValue) {
        double value = environment.getProperty(key, Double.class, defaultValue);
        if (value < 0.0 || Double.isNaN(value)) {
            throw new IllegalStateException(key + " must not be negative but was " + value);
        }
        return value;
    }

    private static Duration duration(PropertyResolver environment, String key, Duration defaultValue) {
        String value = environment.getProperty(key);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        Duration parsed;
        try {
            parsed = DurationStyle.detectAndParse(value.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException(key + " is not a valid duration: " + value, ex);
        }
        if (parsed.isNegative()) {
            throw new IllegalStateException(key + " must not be negative but was " + value);
        }
        return parsed;
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value.trim();
            }
        }
        return null;
    }
}
