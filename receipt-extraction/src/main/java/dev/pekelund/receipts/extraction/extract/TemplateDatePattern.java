package dev.pekelund.receipts.extraction.extract;

import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Merchant specific date layout. The pattern must declare a {@code date} group that the
 * formatter parses.
 */
public record TemplateDatePattern(Pattern pattern, DateTimeFormatter formatter) {

    public TemplateDatePattern {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(formatter, "formatter");
        if (!pattern.pattern().contains("(?<date>")) {
            throw new IllegalArgumentException("Date pattern must declare a 'date' group: " + pattern.pattern());
        }
    }
}
