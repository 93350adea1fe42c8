package dev.pekelund.receipts.extraction.extract;

import dev.pekelund.receipts.model.Store;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Store name and contact details found near the top of a receipt.
 */
final class StoreFields {

    private static final int STORE_NAME_SEARCH_LINES = 5;
    private static final int ADDRESS_SEARCH_LINES = 3;

    private static final Pattern WELCOME_PREFIX = Pattern.compile("^(?:welcome\\s+to\\s+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LETTER = Pattern.compile("\\p{L}.*\\p{L}");
    private static final Pattern STREET_NUMBER = Pattern.compile("^\\d+[a-z]?\\s+\\p{L}", Pattern.CASE_INSENSITIVE);
    private static final Pattern STREET_SUFFIX = Pattern.compile(
        "\\b(?:street|st|avenue|ave|road|rd|boulevard|blvd|drive|dr|lane|ln|way|suite|ste|highway|hwy)\\b\\.?",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern LABELLED_PHONE = Pattern.compile(
        "\\b(?:tel|phone|ph)\\b\\.?\\s*:?\\s*(\\+?[\\d(][\\d\\s().-]{6,}\\d)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile("(\\(?\\b\\d{3}\\)?[\\s.-]\\d{3}[\\s.-]\\d{4})\\b");
    private static final Pattern WEBSITE = Pattern.compile(
        "\\b((?:https?://)?www\\.[\\w.-]+\\.[a-z]{2,}|https?://[\\w.-]+\\.[a-z]{2,}|[a-z0-9-]+\\.(?:com|net|org))\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern TAX_ID = Pattern.compile(
        "\\b(?:tax\\s*id|tin|ein|gst|vat|abn)\\b\\.?\\s*(?:no\\.?|#|number)?\\s*:?\\s*([A-Z0-9][A-Z0-9-]{4,})",
        Pattern.CASE_INSENSITIVE);

    private StoreFields() {
    }

    static Optional<StoreCandidate> findName(List<String> lines) {
        int limit = Math.min(STORE_NAME_SEARCH_LINES, lines.size());
        for (int index = 0; index < limit; index++) {
            String line = WELCOME_PREFIX.matcher(lines.get(index)).replaceFirst("").strip();
            if (line.isEmpty() || !LETTER.matcher(line).find()) {
                continue;
            }
            if (ReceiptAmounts.containsAmount(line) || DateFields.containsDate(line) || isTotalsLine(line)) {
                continue;
            }
            if (STREET_NUMBER.matcher(line).find() || PHONE.matcher(line).find() || LABELLED_PHONE.matcher(line).find()) {
                continue;
            }
            return Optional.of(new StoreCandidate(line, index));
        }
        return Optional.empty();
    }

    static Store details(String name, List<String> lines, int nameIndex) {
        return new Store(name, address(lines, nameIndex), phone(lines), website(lines), taxId(lines));
    }

    private static String address(List<String> lines, int nameIndex) {
        int start = Math.max(nameIndex + 1, 0);
        int end = Math.min(lines.size(), start + ADDRESS_SEARCH_LINES);
        for (int index = start; index < end; index++) {
            String line = lines.get(index);
            if (ReceiptAmounts.containsAmount(line) || PHONE.matcher(line).find()) {
                continue;
            }
            if (STREET_NUMBER.matcher(line).find() || STREET_SUFFIX.matcher(line).find()) {
                return line;
            }
        }
        return null;
    }

    private static String phone(List<String> lines) {
        for (String line : lines) {
            Matcher labelled = LABELLED_PHONE.matcher(line);
            if (labelled.find()) {
                return labelled.group(1).strip();
            }
        }
        for (String line : lines) {
            Matcher matcher = PHONE.matcher(line);
            if (matcher.find()) {
                return matcher.group(1).strip();
            }
        }
        return null;
    }

    private static String website(List<String> lines) {
        for (String line : lines) {
            Matcher matcher = WEBSITE.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private static String taxId(List<String> lines) {
        for (String line : lines) {
            Matcher matcher = TAX_ID.matcher(line);
            if (matcher.find() && matcher.group(1).chars().anyMatch(Character::isDigit)) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private static boolean isTotalsLine(String line) {
        for (TotalsField field : TotalsField.values()) {
            if (field.matchesAny(line)) {
                return true;
            }
        }
        return false;
    }

    record StoreCandidate(String name, int lineIndex) {
    }
}
