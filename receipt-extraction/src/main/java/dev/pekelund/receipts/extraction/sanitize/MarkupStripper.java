package dev.pekelund.receipts.extraction.sanitize;

/**
 * Allow-list based markup removal. Implementations keep text content and drop every tag,
 * attribute and script or style body.
 */
public interface MarkupStripper {

    String strip(String text);
}
