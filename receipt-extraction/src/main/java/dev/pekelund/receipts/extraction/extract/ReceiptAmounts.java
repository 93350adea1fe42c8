package dev.pekelund.receipts.extraction.extract;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Currency amount patterns and parsing shared by the extractors.
 */
public final class ReceiptAmounts {

    /**
     * Regex fragment for a currency amount with exactly two decimals. Template item patterns may
     * reference it through the {@code {amount}} placeholder.
     */
    public static final String AMOUNT = "[-−]?(?:[$€£]\\s?)?(?:\\d{1,3}(?:,\\d{3})+|\\d+)[.,]\\d{2}-?";

    private static final Pattern AMOUNT_IN_TEXT = Pattern.compile("(?<![\\d.,])" + AMOUNT + "(?!\\d)");
    private static final Pattern AMOUNT_ONLY = Pattern.compile("\\s*" + AMOUNT + "\\s*");
    private static final Pattern COMMA_DECIMAL = Pattern.compile("\\d+,\\d{2}");

    private ReceiptAmounts() {
    }

    public static Optional<BigDecimal> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        String cleaned = token.strip().replaceAll("[$€£\\s]", "");
        boolean negative = false;
        if (cleaned.startsWith("-") || cleaned.startsWith("−")) {
            negative = true;
            cleaned = cleaned.substring(1);
        }
        if (cleaned.endsWith("-")) {
            negative = true;
            cleaned = cleaned.substring(0, cleaned.length() - 1);
        }
        if (cleaned.contains(".") && cleaned.contains(",")) {
            cleaned = cleaned.replace(",", "");
        } else if (COMMA_DECIMAL.matcher(cleaned).matches()) {
            cleaned = cleaned.replace(',', '.');
        } else {
            cleaned = cleaned.replace(",", "");
        }
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        try {
            BigDecimal value = new BigDecimal(cleaned).setScale(2, RoundingMode.HALF_UP);
            return Optional.of(negative ? value.negate() : value);
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    /**
     * @return the right-most amount on the line, where receipts print prices
     */
    public static Optional<BigDecimal> lastAmount(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher matcher = AMOUNT_IN_TEXT.matcher(line);
        String last = null;
        while (matcher.find()) {
            last = matcher.group();
        }
        return parse(last);
    }

    public static boolean containsAmount(String line) {
        return line != null && AMOUNT_IN_TEXT.matcher(line).find();
    }

    public static boolean isAmountOnly(String line) {
        return line != null && AMOUNT_ONLY.matcher(line).matches();
    }
}
