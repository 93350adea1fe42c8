package dev.pekelund.receipts.extraction.ocr;

import org.springframework.util.StringUtils;

/**
 * Image submitted for text recognition, either as raw bytes or as a URI the vision service can
 * read directly (for example {@code gs://bucket/object} or a public https URL).
 */
public record ImagePayload(byte[] content, String uri, String sourceName, String contentType) {

    public ImagePayload {
        boolean hasContent = content != null && content.length > 0;
        boolean hasUri = StringUtils.hasText(uri);
        if (hasContent == hasUri) {
            throw new IllegalArgumentException("Exactly one of image content or image uri must be provided");
        }
    }

    public static ImagePayload ofBytes(byte[] content, String sourceName, String contentType) {
        return new ImagePayload(content, null, sourceName, contentType);
    }

    public static ImagePayload ofUri(String uri) {
        String trimmed = uri != null ? uri.trim() : null;
        return new ImagePayload(null, trimmed, trimmed, null);
    }

    public boolean isReference() {
        return uri != null;
    }

    public String describe() {
        if (isReference()) {
            return uri;
        }
        return (StringUtils.hasText(sourceName) ? sourceName : "upload") + " (" + content.length + " bytes)";
    }
}
