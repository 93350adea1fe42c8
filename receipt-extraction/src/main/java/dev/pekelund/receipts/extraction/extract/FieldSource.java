package dev.pekelund.receipts.extraction.extract;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Origin of an extracted value: a merchant specific pattern, a generic heuristic or a default
 * assumed because the receipt did not state the value.
 */
public enum FieldSource {
    TEMPLATE,
    GENERIC,
    DEFAULT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
