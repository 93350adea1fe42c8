package dev.pekelund.receipts.extraction.extract;

import dev.pekelund.receipts.model.PaymentInfo;
import dev.pekelund.receipts.model.PaymentMethod;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class PaymentFields {

    private static final Map<String, Pattern> CARD_BRANDS = new LinkedHashMap<>();
    private static final Map<String, Pattern> WALLETS = new LinkedHashMap<>();

    static {
        CARD_BRANDS.put("VISA", Pattern.compile("\\bvisa\\b", Pattern.CASE_INSENSITIVE));
        CARD_BRANDS.put("MASTERCARD", Pattern.compile("\\bmaster\\s?card\\b", Pattern.CASE_INSENSITIVE));
        CARD_BRANDS.put("AMEX", Pattern.compile("\\b(?:amex|american\\s+express)\\b", Pattern.CASE_INSENSITIVE));
        CARD_BRANDS.put("DISCOVER", Pattern.compile("\\bdiscover\\b", Pattern.CASE_INSENSITIVE));
        WALLETS.put("PAYPAL", Pattern.compile("\\bpay\\s?pal\\b", Pattern.CASE_INSENSITIVE));
        WALLETS.put("VENMO", Pattern.compile("\\bvenmo\\b", Pattern.CASE_INSENSITIVE));
        WALLETS.put("APPLE PAY", Pattern.compile("\\bapple\\s?pay\\b", Pattern.CASE_INSENSITIVE));
        WALLETS.put("GOOGLE PAY", Pattern.compile("\\b(?:google\\s?pay|gpay)\\b", Pattern.CASE_INSENSITIVE));
    }

    private static final Pattern DEBIT = Pattern.compile("\\b(?:debit|interac)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CREDIT = Pattern.compile("\\bcredit\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CASH = Pattern.compile("\\bcash\\b", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> CARD_LAST_FOUR = List.of(
        Pattern.compile("(?:[x*#•]{4,}[\\s-]*)+(\\d{4})\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bcard\\s*#?\\s*[x*]+(\\d{4})\\b", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bending\\s+(?:in\\s+)?(\\d{4})\\b", Pattern.CASE_INSENSITIVE));
    private static final Pattern TRANSACTION_ID = Pattern.compile(
        "\\b(?:trans(?:action)?|txn|ref)\\b\\.?\\s*(?:#|no\\.?|id)?\\s*:?\\s*([A-Z0-9][A-Z0-9-]{3,})",
        Pattern.CASE_INSENSITIVE);

    private PaymentFields() {
    }

    static Optional<PaymentCandidate> find(List<String> lines) {
        String cardType = null;
        PaymentMethod method = null;
        int methodLine = -1;

        for (int index = 0; index < lines.size() && method == null; index++) {
            String line = lines.get(index);
            String brand = firstMatch(CARD_BRANDS, line);
            String wallet = firstMatch(WALLETS, line);
            if (brand != null) {
                cardType = brand;
                method = DEBIT.matcher(line).find() ? PaymentMethod.DEBIT : PaymentMethod.CREDIT;
            } else if (wallet != null) {
                cardType = wallet;
                method = PaymentMethod.DIGITAL;
            } else if (DEBIT.matcher(line).find()) {
                method = PaymentMethod.DEBIT;
            } else if (CREDIT.matcher(line).find()) {
                method = PaymentMethod.CREDIT;
            } else if (CASH.matcher(line).find()) {
                method = PaymentMethod.CASH;
            }
            if (method != null) {
                methodLine = index;
            }
        }

        String lastFour = null;
        int lastFourLine = -1;
        for (int index = 0; index < lines.size() && lastFour == null; index++) {
            for (Pattern pattern : CARD_LAST_FOUR) {
                Matcher matcher = pattern.matcher(lines.get(index));
                if (matcher.find()) {
                    lastFour = matcher.group(1);
                    lastFourLine = index;
                    break;
                }
            }
        }

        if (method == null && lastFour == null) {
            return Optional.empty();
        }
        if (method == null) {
            method = PaymentMethod.CREDIT;
            methodLine = lastFourLine;
        }
        if (method == PaymentMethod.CASH) {
            lastFour = null;
        }
        return Optional.of(new PaymentCandidate(new PaymentInfo(method, cardType, lastFour, transactionId(lines)),
            methodLine));
    }

    private static String transactionId(List<String> lines) {
        for (String line : lines) {
            Matcher matcher = TRANSACTION_ID.matcher(line);
            if (matcher.find() && matcher.group(1).chars().anyMatch(Character::isDigit)) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private static String firstMatch(Map<String, Pattern> candidates, String line) {
        for (Map.Entry<String, Pattern> entry : candidates.entrySet()) {
            if (entry.getValue().matcher(line).find()) {
                return entry.getKey();
            }
        }
        return null;
    }

    record PaymentCandidate(PaymentInfo paymentInfo, int lineIndex) {
    }
}
