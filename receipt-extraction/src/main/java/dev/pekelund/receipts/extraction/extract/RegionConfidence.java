package dev.pekelund.receipts.extraction.extract;

import dev.pekelund.receipts.extraction.ocr.OcrRegion;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Looks up the OCR confidence reported for the region a sanitized line came from.
 */
public final class RegionConfidence {

    public static final RegionConfidence NONE = new RegionConfidence(List.of());

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_PARTIAL_MATCH_LENGTH = 3;

    private final List<RegionLine> regionLines;

    private RegionConfidence(List<RegionLine> regionLines) {
        this.regionLines = List.copyOf(regionLines);
    }

    public static RegionConfidence from(List<OcrRegion> regions) {
        if (regions == null || regions.isEmpty()) {
            return NONE;
        }
        List<RegionLine> lines = new ArrayList<>();
        for (OcrRegion region : regions) {
            for (String line : region.text().split("\n")) {
                String key = key(line);
                if (!key.isEmpty()) {
                    lines.add(new RegionLine(key, region.confidence()));
                }
            }
        }
        return new RegionConfidence(lines);
    }

    public OptionalDouble forLine(String line) {
        if (regionLines.isEmpty() || line == null) {
            return OptionalDouble.empty();
        }
        String key = key(line);
        if (key.isEmpty()) {
            return OptionalDouble.empty();
        }
        return regionLines.stream()
            .filter(regionLine -> regionLine.key().contains(key)
                || (regionLine.key().length() >= MIN_PARTIAL_MATCH_LENGTH && key.contains(regionLine.key())))
            .mapToDouble(RegionLine::confidence)
            .average();
    }

    public boolean isEmpty() {
        return regionLines.isEmpty();
    }

    private static String key(String text) {
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    private record RegionLine(String key, double confidence) {
    }
}
