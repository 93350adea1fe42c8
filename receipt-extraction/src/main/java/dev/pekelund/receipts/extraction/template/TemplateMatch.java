package dev.pekelund.receipts.extraction.template;

import java.util.Objects;

/**
 * Outcome of template detection. {@code fallback} is set when no registered template reached the
 * acceptance threshold and the generic template was chosen.
 */
public record TemplateMatch(ReceiptTemplate template, double score, String longestAnchor, boolean fallback) {

    public TemplateMatch {
        Objects.requireNonNull(template, "template");
    }

    public String templateId() {
        return template.id();
    }
}
