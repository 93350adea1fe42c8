package dev.pekelund.receipts.extraction.extract;

import java.util.OptionalDouble;

/**
 * Tunable weights used to derive field confidence from pattern specificity and OCR confidence.
 */
public record FieldConfidencePolicy(
    double templatePatternConfidence,
    double genericPatternConfidence,
    double heuristicConfidence,
    double defaultValuePenalty,
    double ocrWeight
) {

    public static final FieldConfidencePolicy DEFAULTS = new FieldConfidencePolicy(0.9, 0.7, 0.5, 0.8, 0.5);

    public FieldConfidencePolicy {
        requireUnit("templatePatternConfidence", templatePatternConfidence);
        requireUnit("genericPatternConfidence", genericPatternConfidence);
        requireUnit("heuristicConfidence", heuristicConfidence);
        requireUnit("defaultValuePenalty", defaultValuePenalty);
        requireUnit("ocrWeight", ocrWeight);
    }

    public double base(FieldSource source) {
        return switch (source) {
            case TEMPLATE -> templatePatternConfidence;
            case GENERIC -> genericPatternConfidence;
            case DEFAULT -> genericPatternConfidence * defaultValuePenalty;
        };
    }

    /**
     * Blends a pattern derived confidence with the OCR confidence of the source line, if known.
     */
    public double combine(double patternConfidence, OptionalDouble ocrConfidence) {
        if (ocrConfidence == null || ocrConfidence.isEmpty()) {
            return clamp(patternConfidence);
        }
        return clamp((1.0 - ocrWeight) * patternConfidence + ocrWeight * ocrConfidence.getAsDouble());
    }

    public double defaulted(double confidence) {
        return clamp(confidence * defaultValuePenalty);
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1] but was " + value);
        }
    }
}
