package dev.pekelund.receipts.extraction.extract;

import java.util.regex.Pattern;

/**
 * Totals keywords in the order they are tried on a line, so "TOTAL SAVINGS" is read as a
 * discount and "SUBTOTAL" never as the total.
 */
public enum TotalsField {
    SUBTOTAL("\\bsub[\\s-]?total\\b", "\\bs[uv]b[\\s-]?t[o0]t[a4][l1i]\\b", true),
    DISCOUNT("\\b(?:discount|savings?|coupon|promo)\\b", "\\bd[i1l]sc[o0]unt\\b", false),
    TIP("\\b(?:tip|gratuity)\\b", "\\bt[i1l]p\\b", false),
    TAX("\\b(?:sales\\s+)?(?:tax|vat|gst|hst|pst)\\b(?!\\s*(?:id|exempt|free|invoice|reg|#))", "\\bt[a4][xk]\\b", true),
    TOTAL("\\b(?:grand\\s+total|total|amount\\s+due|balance\\s+due)\\b", "\\bt[o0]t[a4][l1i]\\b", true);

    private final Pattern keyword;
    private final Pattern noisyKeyword;
    private final boolean startsTotalsBlock;

    TotalsField(String keyword, String noisyKeyword, boolean startsTotalsBlock) {
        this.keyword = Pattern.compile(keyword, Pattern.CASE_INSENSITIVE);
        this.noisyKeyword = Pattern.compile(noisyKeyword, Pattern.CASE_INSENSITIVE);
        this.startsTotalsBlock = startsTotalsBlock;
    }

    /**
     * @return whether the first line with this keyword ends the item section
     */
    public boolean startsTotalsBlock() {
        return startsTotalsBlock;
    }

    public Pattern keyword() {
        return keyword;
    }

    public Pattern noisyKeyword() {
        return noisyKeyword;
    }

    public boolean matchesAny(String line) {
        return keyword.matcher(line).find() || noisyKeyword.matcher(line).find();
    }
}
