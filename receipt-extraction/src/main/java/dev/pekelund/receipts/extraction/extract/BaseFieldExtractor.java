package dev.pekelund.receipts.extraction.extract;

import dev.pekelund.receipts.extraction.sanitize.SanitizedText;
import dev.pekelund.receipts.model.PaymentInfo;
import dev.pekelund.receipts.model.Store;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line oriented extraction shared by the generic and the merchant specific extractors. Subclasses
 * decide how the store is named and may contribute their own item, totals and date patterns,
 * which are tried before the generic ones.
 */
public abstract class BaseFieldExtractor implements FieldExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(BaseFieldExtractor.class);

    private static final String AMOUNT = ReceiptAmounts.AMOUNT;
    private static final String TAX_FLAG = "(?:\\s+[A-Z]{1,2})?";
    private static final double NOISY_KEYWORD_FACTOR = 0.9;

    private static final Pattern MULTIPLIER_ITEM = Pattern.compile(
        "(?<qty>\\d{1,3})\\s*(?:x|×|@|\\*)\\s*(?<name>.*?\\p{L}.*?)\\s+(?<amount>" + AMOUNT + ")" + TAX_FLAG,
        Pattern.CASE_INSENSITIVE);
    private static final Pattern EXPLICIT_UNIT_ITEM = Pattern.compile(
        "(?<name>.*?\\p{L}.*?)\\s+(?<qty>\\d{1,3})\\s*(?:x|×|@|\\*)\\s*(?<unit>" + AMOUNT + ")\\s+(?<amount>" + AMOUNT
            + ")" + TAX_FLAG, Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME_AMOUNT_ITEM = Pattern.compile(
        "(?<name>.*?\\p{L}.*?)\\s+(?<amount>" + AMOUNT + ")" + TAX_FLAG, Pattern.CASE_INSENSITIVE);
    private static final Pattern LOOSE_ITEM = Pattern.compile(
        "(?<name>.*?\\p{L}.*?)\\s+(?<amount>" + AMOUNT + ")(?:\\s.*)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_ITEM_KEYWORDS = Pattern.compile(
        "\\b(?:change|tender(?:ed)?|cash|visa|mastercard|amex|debit|credit|balance|payment|paid)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME_NOISE = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N})%]+$");

    protected final FieldConfidencePolicy confidencePolicy;

    protected BaseFieldExtractor(FieldConfidencePolicy confidencePolicy) {
        this.confidencePolicy = Objects.requireNonNull(confidencePolicy, "confidencePolicy");
    }

    /**
     * @return identifier of the template this extractor belongs to
     */
    public abstract String templateId();

    protected abstract ExtractedField<Store> extractStore(List<String> lines, RegionConfidence regions);

    protected List<Pattern> templateItemPatterns() {
        return List.of();
    }

    protected Map<TotalsField, Pattern> templateTotalsKeywords() {
        return Map.of();
    }

    protected List<TemplateDatePattern> templateDatePatterns() {
        return List.of();
    }

    @Override
    public ExtractedReceipt extract(SanitizedText text, RegionConfidence regions) {
        Objects.requireNonNull(text, "text");
        RegionConfidence resolvedRegions = regions != null ? regions : RegionConfidence.NONE;
        List<String> lines = text.lines();
        List<String> warnings = new ArrayList<>();

        TotalsScan totalsScan = scanTotals(lines, resolvedRegions);
        int itemsEnd = totalsScan.firstLine() >= 0 ? totalsScan.firstLine() : lines.size();
        ItemScan itemScan = scanItems(lines, itemsEnd, resolvedRegions);

        ExtractedTotals totals = totalsScan.totals();
        if (totals.discount() == null && itemScan.lineDiscounts().signum() > 0) {
            double confidence = confidencePolicy.combine(confidencePolicy.heuristicConfidence(), OptionalDouble.empty());
            totals = totals.withDiscount(new ExtractedField<>(itemScan.lineDiscounts(), confidence, FieldSource.GENERIC));
            warnings.add("Discount derived from negative item lines");
        }

        ExtractedField<Store> store = extractStore(lines, resolvedRegions);
        ExtractedField<LocalDate> date = extractDate(lines, resolvedRegions);
        ExtractedField<PaymentInfo> payment = extractPayment(lines, resolvedRegions);

        LOGGER.debug("Template '{}' extracted store={}, {} items, totals present={}, date={}, payment={}",
            templateId(), store != null, itemScan.items().size(), !totals.isBlockAbsent(), date != null,
            payment != null);
        return new ExtractedReceipt(templateId(), store, date, itemScan.items(), totals, payment, warnings);
    }

    protected ExtractedField<Store> storeField(String name, List<String> lines, int nameIndex, FieldSource source,
        RegionConfidence regions) {
        OptionalDouble ocr = nameIndex >= 0 ? regions.forLine(lines.get(nameIndex)) : OptionalDouble.empty();
        double confidence = confidencePolicy.combine(confidencePolicy.base(source), ocr);
        return new ExtractedField<>(StoreFields.details(name, lines, nameIndex), confidence, source);
    }

    protected Optional<StoreFields.StoreCandidate> findStoreCandidate(List<String> lines) {
        return StoreFields.findName(lines);
    }

    private TotalsScan scanTotals(List<String> lines, RegionConfidence regions) {
        Map<TotalsField, ExtractedField<BigDecimal>> values = new EnumMap<>(TotalsField.class);
        Map<TotalsField, Pattern> overrides = templateTotalsKeywords();
        int firstLine = -1;

        for (int index = 0; index < lines.size(); index++) {
            String line = lines.get(index);
            for (TotalsField field : TotalsField.values()) {
                KeywordMatch keywordMatch = matchKeyword(field, overrides.get(field), line);
                if (keywordMatch == null) {
                    continue;
                }
                Optional<BigDecimal> amount = ReceiptAmounts.lastAmount(line);
                String amountLine = line;
                if (amount.isEmpty() && index + 1 < lines.size() && ReceiptAmounts.isAmountOnly(lines.get(index + 1))) {
                    amountLine = lines.get(index + 1);
                    amount = ReceiptAmounts.parse(amountLine);
                }
                if (amount.isEmpty()) {
                    break;
                }
                if (firstLine < 0 && field.startsTotalsBlock()) {
                    firstLine = index;
                }
                if (!values.containsKey(field)) {
                    BigDecimal value = field == TotalsField.DISCOUNT ? amount.get().abs() : amount.get();
                    double confidence = confidencePolicy.combine(
                        confidencePolicy.base(keywordMatch.source()) * keywordMatch.factor(),
                        regions.forLine(amountLine));
                    values.put(field, new ExtractedField<>(value, confidence, keywordMatch.source()));
                }
                break;
            }
        }

        ExtractedTotals totals = new ExtractedTotals(values.get(TotalsField.SUBTOTAL), values.get(TotalsField.TAX),
            values.get(TotalsField.TOTAL), values.get(TotalsField.TIP), values.get(TotalsField.DISCOUNT));
        return new TotalsScan(totals, firstLine);
    }

    private KeywordMatch matchKeyword(TotalsField field, Pattern override, String line) {
        if (override != null && override.matcher(line).find()) {
            return new KeywordMatch(FieldSource.TEMPLATE, 1.0);
        }
        if (field.keyword().matcher(line).find()) {
            return new KeywordMatch(FieldSource.GENERIC, 1.0);
        }
        if (field.noisyKeyword().matcher(line).find()) {
            return new KeywordMatch(FieldSource.GENERIC, NOISY_KEYWORD_FACTOR);
        }
        return null;
    }

    private ItemScan scanItems(List<String> lines, int end, RegionConfidence regions) {
        List<ExtractedItem> items = new ArrayList<>();
        BigDecimal lineDiscounts = BigDecimal.ZERO;

        for (int index = 0; index < end; index++) {
            String line = lines.get(index);
            if (!ReceiptAmounts.containsAmount(line) || isNonItemLine(line)) {
                continue;
            }
            Optional<ItemMatch> match = matchItem(line);
            if (match.isEmpty()) {
                continue;
            }
            ItemMatch itemMatch = match.get();
            Optional<BigDecimal> amount = ReceiptAmounts.parse(itemMatch.matcher().group("amount"));
            if (amount.isEmpty()) {
                continue;
            }
            if (amount.get().signum() < 0) {
                lineDiscounts = lineDiscounts.add(amount.get().abs());
                continue;
            }
            toItem(itemMatch, amount.get(), index, regions.forLine(line)).ifPresent(items::add);
        }
        return new ItemScan(items, lineDiscounts);
    }

    private Optional<ItemMatch> matchItem(String line) {
        for (Pattern pattern : templateItemPatterns()) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.matches()) {
                return Optional.of(new ItemMatch(matcher, FieldSource.TEMPLATE, 1.0));
            }
        }
        for (Pattern pattern : List.of(MULTIPLIER_ITEM, EXPLICIT_UNIT_ITEM, NAME_AMOUNT_ITEM)) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.matches()) {
                return Optional.of(new ItemMatch(matcher, FieldSource.GENERIC, 1.0));
            }
        }
        Matcher loose = LOOSE_ITEM.matcher(line);
        if (loose.matches()) {
            double factor = confidencePolicy.heuristicConfidence() / confidencePolicy.genericPatternConfidence();
            return Optional.of(new ItemMatch(loose, FieldSource.GENERIC, Math.min(1.0, factor)));
        }
        return Optional.empty();
    }

    private Optional<ExtractedItem> toItem(ItemMatch itemMatch, BigDecimal price, int lineIndex, OptionalDouble ocr) {
        Matcher matcher = itemMatch.matcher();
        String name = NAME_NOISE.matcher(matcher.group("name")).replaceAll("").replaceAll("\\s+", " ");
        if (name.isEmpty() || name.codePoints().noneMatch(Character::isLetter)) {
            return Optional.empty();
        }

        FieldSource source = itemMatch.source();
        double confidence = confidencePolicy.combine(confidencePolicy.base(source) * itemMatch.factor(), ocr);

        Integer explicitQuantity = optionalGroup(matcher, "qty").map(Integer::valueOf).filter(qty -> qty > 0)
            .orElse(null);
        ExtractedField<Integer> quantity = explicitQuantity != null
            ? new ExtractedField<>(explicitQuantity, confidence, source)
            : new ExtractedField<>(1, confidencePolicy.defaulted(confidence), FieldSource.DEFAULT);

        ExtractedField<BigDecimal> unitPrice = optionalGroup(matcher, "unit")
            .flatMap(ReceiptAmounts::parse)
            .map(unit -> new ExtractedField<>(unit.abs(), confidence, source))
            .orElse(null);
        if (unitPrice == null && quantity.value() > 1) {
            BigDecimal derived = price.divide(BigDecimal.valueOf(quantity.value()), 2, RoundingMode.HALF_UP);
            unitPrice = new ExtractedField<>(derived, confidence, source);
        }

        BigDecimal taxRate = optionalGroup(matcher, "taxRate")
            .map(rate -> rate.replace(',', '.').replace("%", "").strip())
            .flatMap(BaseFieldExtractor::decimal)
            .orElse(null);

        return Optional.of(new ExtractedItem(
            new ExtractedField<>(name, confidence, source),
            new ExtractedField<>(price, confidence, source),
            quantity,
            unitPrice,
            ItemCategorizer.categorize(name),
            taxRate,
            lineIndex));
    }

    private ExtractedField<LocalDate> extractDate(List<String> lines, RegionConfidence regions) {
        return DateFields.find(lines, templateDatePatterns())
            .map(candidate -> {
                FieldSource source = candidate.templateSpecific() ? FieldSource.TEMPLATE : FieldSource.GENERIC;
                double confidence = confidencePolicy.combine(confidencePolicy.base(source) * candidate.specificity(),
                    regions.forLine(lines.get(candidate.lineIndex())));
                return new ExtractedField<>(candidate.date(), confidence, source);
            })
            .orElse(null);
    }

    private ExtractedField<PaymentInfo> extractPayment(List<String> lines, RegionConfidence regions) {
        return PaymentFields.find(lines)
            .map(candidate -> new ExtractedField<>(candidate.paymentInfo(),
                confidencePolicy.combine(confidencePolicy.base(FieldSource.GENERIC),
                    regions.forLine(lines.get(candidate.lineIndex()))),
                FieldSource.GENERIC))
            .orElse(null);
    }

    private boolean isNonItemLine(String line) {
        if (NON_ITEM_KEYWORDS.matcher(line).find()) {
            return true;
        }
        for (TotalsField field : TotalsField.values()) {
            Pattern override = templateTotalsKeywords().get(field);
            if (field.matchesAny(line) || (override != null && override.matcher(line).find())) {
                return true;
            }
        }
        return false;
    }

    private static Optional<String> optionalGroup(Matcher matcher, String group) {
        if (!matcher.pattern().pattern().contains("(?<" + group + ">")) {
            return Optional.empty();
        }
        return Optional.ofNullable(matcher.group(group)).filter(value -> !value.isBlank());
    }

    private static Optional<BigDecimal> decimal(String value) {
        try {
            return Optional.of(new BigDecimal(value));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private record TotalsScan(ExtractedTotals totals, int firstLine) {
    }

    private record ItemScan(List<ExtractedItem> items, BigDecimal lineDiscounts) {
    }

    private record ItemMatch(Matcher matcher, FieldSource source, double factor) {
    }

    private record KeywordMatch(FieldSource source, double factor) {
    }
}
