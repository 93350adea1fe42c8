package dev.pekelund.receipts.extraction.assembly;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.receipts.extraction.extract.ExtractedReceipt;
import dev.pekelund.receipts.model.Receipt;
import java.util.ArrayList;
import java.util.List;

/**
 * The only artifact returned to callers. {@code data} is a {@link Receipt} when {@code success} is
 * set and the partial {@link ExtractedReceipt} (or nothing) otherwise. On success {@code errors}
 * carries non-fatal warnings.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ReceiptParsingResponse(
    boolean success,
    Object data,
    String rawText,
    Double confidence,
    List<String> errors
) {

    public ReceiptParsingResponse {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (confidence != null && !(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0, 1] but was " + confidence);
        }
        if (success && !(data instanceof Receipt)) {
            throw new IllegalArgumentException("A successful response must carry a receipt");
        }
    }

    public static ReceiptParsingResponse success(Receipt receipt, List<String> warnings) {
        return new ReceiptParsingResponse(true, receipt, receipt.rawText(), receipt.confidence(), warnings);
    }

    public static ReceiptParsingResponse partialFailure(ExtractedReceipt extracted, String rawText, double confidence,
        List<String> errors) {
        return new ReceiptParsingResponse(false, extracted, rawText, confidence, errors);
    }

    public static ReceiptParsingResponse failure(List<String> errors) {
        return new ReceiptParsingResponse(false, null, null, null, errors);
    }

    public static ReceiptParsingResponse failure(String error) {
        return failure(List.of(error));
    }

    public ReceiptParsingResponse withAdditionalError(String error) {
        List<String> combined = new ArrayList<>(errors);
        combined.add(error);
        return new ReceiptParsingResponse(success, data, rawText, confidence, combined);
    }

    public Receipt receipt() {
        return data instanceof Receipt receipt ? receipt : null;
    }
}
