package dev.pekelund.receipts.extraction.ocr;

import java.util.List;

/**
 * Text recognised from a single receipt image. Regions are optional and empty when the vision
 * service did not report block level confidence.
 */
public record RawOcrResult(String text, List<OcrRegion> regions, String languageCode) {

    public RawOcrResult {
        text = text == null ? "" : text;
        regions = regions == null ? List.of() : List.copyOf(regions);
    }

    public static RawOcrResult textOnly(String text) {
        return new RawOcrResult(text, List.of(), null);
    }
}
