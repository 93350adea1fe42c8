package dev.pekelund.receipts.extraction.extract;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Merchant specific patterns used by a {@link TemplateFieldExtractor}. Item patterns must declare
 * {@code name} and {@code amount} groups and may declare {@code qty}, {@code unit} and
 * {@code taxRate}.
 */
public record TemplatePatterns(
    String storeName,
    List<Pattern> itemPatterns,
    Map<TotalsField, Pattern> totalsKeywords,
    List<TemplateDatePattern> datePatterns
) {

    public TemplatePatterns {
        Objects.requireNonNull(storeName, "storeName");
        itemPatterns = itemPatterns == null ? List.of() : List.copyOf(itemPatterns);
        totalsKeywords = totalsKeywords == null || totalsKeywords.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(totalsKeywords));
        datePatterns = datePatterns == null ? List.of() : List.copyOf(datePatterns);
        for (Pattern pattern : itemPatterns) {
            String source = pattern.pattern();
            if (!source.contains("(?<name>") || !source.contains("(?<amount>")) {
                throw new IllegalArgumentException("Item pattern must declare 'name' and 'amount' groups: " + source);
            }
        }
    }

    public static TemplatePatterns storeNameOnly(String storeName) {
        return new TemplatePatterns(storeName, List.of(), Map.of(), List.of());
    }
}
