package dev.pekelund.receipts.extraction.template;

import dev.pekelund.receipts.extraction.extract.FieldExtractor;
import java.util.List;
import java.util.Objects;

/**
 * Named merchant layout with its anchors and extraction strategy.
 */
public record ReceiptTemplate(String id, String displayName, List<AnchorToken> anchors, FieldExtractor extractor) {

    public ReceiptTemplate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(extractor, "extractor");
        displayName = displayName != null ? displayName : id;
        anchors = anchors == null ? List.of() : List.copyOf(anchors);
    }

    public double totalAnchorWeight() {
        return anchors.stream().mapToDouble(AnchorToken::weight).sum();
    }
}
