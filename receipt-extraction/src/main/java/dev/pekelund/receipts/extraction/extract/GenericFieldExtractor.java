package dev.pekelund.receipts.extraction.extract;

import dev.pekelund.receipts.model.Store;
import java.util.List;

/**
 * Heuristic extractor used when no merchant template matches the receipt text.
 */
public class GenericFieldExtractor extends BaseFieldExtractor {

    public static final String TEMPLATE_ID = "generic";

    public GenericFieldExtractor(FieldConfidencePolicy confidencePolicy) {
        super(confidencePolicy);
    }

    @Override
    public String templateId() {
        return TEMPLATE_ID;
    }

    @Override
    protected ExtractedField<Store> extractStore(List<String> lines, RegionConfidence regions) {
        return findStoreCandidate(lines)
            .map(candidate -> storeField(candidate.name(), lines, candidate.lineIndex(), FieldSource.GENERIC, regions))
            .orElse(null);
    }
}
