package dev.pekelund.receipts.extraction.template;

import dev.pekelund.receipts.extraction.sanitize.SanitizedText;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores sanitized text against every registered template and selects the best one, or the
 * generic template when none reaches the acceptance threshold. Stateless.
 */
public class TemplateDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateDetector.class);

    public static final double DEFAULT_ACCEPTANCE_THRESHOLD = 0.5;

    private final TemplateRegistry registry;
    private final double acceptanceThreshold;

    public TemplateDetector(TemplateRegistry registry, double acceptanceThreshold) {
        this.registry = Objects.requireNonNull(registry, "registry");
        if (!(acceptanceThreshold > 0.0 && acceptanceThreshold <= 1.0)) {
            throw new IllegalArgumentException("Acceptance threshold must be within (0, 1]");
        }
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public TemplateMatch detect(SanitizedText text) {
        Objects.requireNonNull(text, "text");
        String normalised = AnchorToken.normalise(text.text());

        TemplateMatch best = null;
        if (!normalised.isEmpty()) {
            for (ReceiptTemplate template : registry.templates()) {
                TemplateMatch candidate = score(template, normalised);
                LOGGER.debug("Template '{}' scored {} (longest anchor '{}')", template.id(),
                    String.format(Locale.ROOT, "%.3f", candidate.score()), candidate.longestAnchor());
                if (isBetter(candidate, best)) {
                    best = candidate;
                }
            }
        }

        if (best == null || best.score() < acceptanceThreshold) {
            LOGGER.debug("No template reached threshold {}; using generic template", acceptanceThreshold);
            return new TemplateMatch(registry.generic(), 0.0, null, true);
        }
        return best;
    }

    public double acceptanceThreshold() {
        return acceptanceThreshold;
    }

    private static TemplateMatch score(ReceiptTemplate template, String normalised) {
        double found = 0.0;
        String longest = null;
        for (AnchorToken anchor : template.anchors()) {
            if (anchor.isFoundIn(normalised)) {
                found += anchor.weight();
                if (longest == null || anchor.token().length() > longest.length()) {
                    longest = anchor.token();
                }
            }
        }
        double score = found / template.totalAnchorWeight();
        return new TemplateMatch(template, Math.min(1.0, score), longest, false);
    }

    // Registration order wins remaining ties because candidates are visited in that order.
    private static boolean isBetter(TemplateMatch candidate, TemplateMatch best) {
        if (candidate.longestAnchor() == null) {
            return false;
        }
        if (best == null) {
            return true;
        }
        int byScore = Double.compare(candidate.score(), best.score());
        if (byScore != 0) {
            return byScore > 0;
        }
        return candidate.longestAnchor().length() > best.longestAnchor().length();
    }
}
