package dev.pekelund.receipts.extraction.sanitize;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cleans untrusted OCR output before extraction and storage. Applying the sanitizer to its own
 * output returns the same text.
 */
public class ReceiptTextSanitizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptTextSanitizer.class);

    public static final int DEFAULT_MAX_LENGTH = 20_000;

    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\p{Cc}\\p{Cf}&&[^\\n]]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("\\h+");
    private static final Pattern SPLIT_DECIMAL_POINT = Pattern.compile("(?<=\\d)(?: \\. ?|\\. )(?=\\d{2}(?!\\d))");
    private static final Pattern SPLIT_DECIMAL_COMMA = Pattern.compile("(?<=\\d) ,(?=\\d{2}(?!\\d))");
    private static final Pattern ANGLE_BRACKETS = Pattern.compile("[<>]");

    private final MarkupStripper markupStripper;
    private final int maxLength;

    public ReceiptTextSanitizer(MarkupStripper markupStripper, int maxLength) {
        this.markupStripper = Objects.requireNonNull(markupStripper, "markupStripper");
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive");
        }
        this.maxLength = maxLength;
    }

    /**
     * Decodes strict UTF-8 bytes and sanitizes the result.
     *
     * @throws SanitizationException if the bytes are not valid UTF-8
     */
    public SanitizedText sanitize(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            return sanitize("");
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return sanitize(decoder.decode(ByteBuffer.wrap(encoded)).toString());
        } catch (CharacterCodingException ex) {
            throw new SanitizationException("Receipt text is not valid UTF-8", ex);
        }
    }

    /**
     * @throws SanitizationException if the text contains unpaired surrogate characters
     */
    public SanitizedText sanitize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return new SanitizedText("", List.of());
        }
        requireWellFormed(raw);

        String text = raw;
        if (text.indexOf('<') >= 0) {
            text = markupStripper.strip(text);
        }
        text = LINE_BREAKS.matcher(text).replaceAll("\n");
        text = text.replace('\t', ' ');
        text = normaliseCharacters(text);
        text = normaliseLines(text);

        List<String> warnings = new ArrayList<>();
        if (text.length() > maxLength) {
            int cut = maxLength;
            if (Character.isHighSurrogate(text.charAt(cut - 1))) {
                cut--;
            }
            String truncated = text.substring(0, cut).stripTrailing();
            String warning = String.format("Receipt text truncated from %d to %d characters", text.length(),
                truncated.length());
            LOGGER.warn(warning);
            warnings.add(warning);
            text = truncated;
        }
        return new SanitizedText(text, warnings);
    }

    // Removing a character can leave a base letter next to a combining mark, so normalise until stable.
    private static String normaliseCharacters(String text) {
        String previous;
        String current = text;
        do {
            previous = current;
            current = Normalizer.normalize(previous, Normalizer.Form.NFKC);
            current = CONTROL_CHARACTERS.matcher(current).replaceAll("");
            current = ANGLE_BRACKETS.matcher(current).replaceAll("");
        } while (!current.equals(previous));
        return current;
    }

    private static String normaliseLines(String text) {
        return text.lines()
            .map(line -> HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ").strip())
            .map(line -> SPLIT_DECIMAL_POINT.matcher(line).replaceAll("."))
            .map(line -> SPLIT_DECIMAL_COMMA.matcher(line).replaceAll(","))
            .filter(line -> !line.isEmpty())
            .collect(Collectors.joining("\n"));
    }

    private static void requireWellFormed(String text) {
        for (int i = 0; i < text.length(); i++) {
            char current = text.charAt(i);
            if (Character.isHighSurrogate(current)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    throw new SanitizationException("Receipt text contains an unpaired surrogate at index " + i);
                }
                i++;
            } else if (Character.isLowSurrogate(current)) {
                throw new SanitizationException("Receipt text contains an unpaired surrogate at index " + i);
            }
        }
    }
}
