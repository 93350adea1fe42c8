package dev.pekelund.receipts.extraction.extract;

import java.util.Objects;

public record ExtractedField<T>(T value, double confidence, FieldSource source) {

    public ExtractedField {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(source, "source");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Field confidence must be within [0, 1] but was " + confidence);
        }
    }
}
