package dev.pekelund.receipts.extraction.sanitize;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Normalised receipt text free of markup and control characters, one receipt line per text line.
 */
public record SanitizedText(String text, List<String> warnings) {

    public SanitizedText {
        Objects.requireNonNull(text, "text");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<String> lines() {
        if (text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\n"));
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
