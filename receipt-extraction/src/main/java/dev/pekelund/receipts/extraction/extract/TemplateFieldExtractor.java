package dev.pekelund.receipts.extraction.extract;

import dev.pekelund.receipts.model.Store;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Extractor for a known merchant layout. Reports the template's canonical store name and tries the
 * merchant patterns before falling back to the generic ones line by line.
 */
public class TemplateFieldExtractor extends BaseFieldExtractor {

    private final String templateId;
    private final TemplatePatterns patterns;

    public TemplateFieldExtractor(String templateId, TemplatePatterns patterns, FieldConfidencePolicy confidencePolicy) {
        super(confidencePolicy);
        this.templateId = Objects.requireNonNull(templateId, "templateId");
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    @Override
    public String templateId() {
        return templateId;
    }

    @Override
    protected ExtractedField<Store> extractStore(List<String> lines, RegionConfidence regions) {
        int nameIndex = findStoreCandidate(lines).map(StoreFields.StoreCandidate::lineIndex).orElse(-1);
        return storeField(patterns.storeName(), lines, nameIndex, FieldSource.TEMPLATE, regions);
    }

    @Override
    protected List<Pattern> templateItemPatterns() {
        return patterns.itemPatterns();
    }

    @Override
    protected Map<TotalsField, Pattern> templateTotalsKeywords() {
        return patterns.totalsKeywords();
    }

    @Override
    protected List<TemplateDatePattern> templateDatePatterns() {
        return patterns.datePatterns();
    }
}
