package dev.pekelund.receipts.extraction.template;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Weighted phrase that identifies a merchant layout. Matching ignores case and runs of whitespace
 * and only accepts whole words.
 */
public final class AnchorToken {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String token;
    private final double weight;
    private final Pattern pattern;

    public AnchorToken(String token, double weight) {
        Objects.requireNonNull(token, "token");
        String normalised = normalise(token);
        if (normalised.isEmpty()) {
            throw new IllegalArgumentException("Anchor token must not be blank");
        }
        if (!(weight > 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Anchor weight must be positive for '" + normalised + "'");
        }
        this.token = normalised;
        this.weight = weight;
        this.pattern = Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(normalised) + "(?![\\p{L}\\p{N}])");
    }

    public String token() {
        return token;
    }

    public double weight() {
        return weight;
    }

    public boolean isFoundIn(String normalisedText) {
        return pattern.matcher(normalisedText).find();
    }

    static String normalise(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof AnchorToken that)) {
            return false;
        }
        return Double.compare(weight, that.weight) == 0 && token.equals(that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(token, weight);
    }

    @Override
    public String toString() {
        return "AnchorToken[token=" + token + ", weight=" + weight + "]";
    }
}
