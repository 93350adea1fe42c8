package dev.pekelund.receipts.extraction.pipeline;

import dev.pekelund.receipts.extraction.assembly.ReceiptParsingResponse;
import dev.pekelund.receipts.extraction.ocr.ImagePayload;
import dev.pekelund.receipts.extraction.ocr.OcrServiceException;
import dev.pekelund.receipts.extraction.ocr.RawOcrResult;
import dev.pekelund.receipts.extraction.ocr.VisionAdapter;
import dev.pekelund.receipts.extraction.persistence.ReceiptRecordStore;
import dev.pekelund.receipts.extraction.persistence.ReceiptStorageException;
import dev.pekelund.receipts.extraction.sanitize.SanitizationException;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for parsing a receipt. Every outcome, including OCR and sanitization failures, is
 * reported as a {@link ReceiptParsingResponse}. Successful receipts are handed to the record store
 * after the response has been produced.
 */
public class ReceiptParsingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptParsingService.class);

    private final VisionAdapter visionAdapter;
    private final ReceiptParsingPipeline pipeline;
    private final ReceiptRecordStore recordStore;

    public ReceiptParsingService(VisionAdapter visionAdapter, ReceiptParsingPipeline pipeline,
        ReceiptRecordStore recordStore) {
        this.visionAdapter = Objects.requireNonNull(visionAdapter, "visionAdapter");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.recordStore = Objects.requireNonNull(recordStore, "recordStore");
    }

    public ReceiptParsingResponse parse(ImagePayload image) {
        Objects.requireNonNull(image, "image");
        try (ReceiptProcessingMdc.Context ignored = ReceiptProcessingMdc.open(image.describe())) {
            ReceiptProcessingMdc.setStage(PipelineStage.RECEIVED.logName());
            LOGGER.info("Received receipt image {}", image.describe());

            RawOcrResult ocrResult;
            try {
                ocrResult = visionAdapter.recognize(image);
            } catch (OcrServiceException ex) {
                LOGGER.error("OCR failed for {}", image.describe(), ex);
                return ReceiptParsingResponse.failure("OCR failed: " + ex.getMessage());
            } catch (RuntimeException ex) {
                LOGGER.error("Unexpected OCR failure for {}", image.describe(), ex);
                return ReceiptParsingResponse.failure("OCR failed: " + ex.getMessage());
            }
            LOGGER.info("OCR returned {} characters in {} regions", ocrResult.text().length(),
                ocrResult.regions().size());

            return persist(run(() -> pipeline.process(ocrResult)));
        }
    }

    public ReceiptParsingResponse parseText(byte[] encodedText, String sourceName) {
        try (ReceiptProcessingMdc.Context ignored = ReceiptProcessingMdc.open(sourceName)) {
            LOGGER.info("Received receipt text from {} ({} bytes)", sourceName,
                encodedText != null ? encodedText.length : 0);
            return persist(run(() -> pipeline.processText(encodedText)));
        }
    }

    private ReceiptParsingResponse run(Supplier<ReceiptParsingResponse> stages) {
        try {
            return stages.get();
        } catch (SanitizationException ex) {
            LOGGER.error("Receipt text could not be sanitized", ex);
            return ReceiptParsingResponse.failure(ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected failure while parsing receipt", ex);
            return ReceiptParsingResponse.failure("Receipt parsing failed: " + ex.getMessage());
        }
    }

    private ReceiptParsingResponse persist(ReceiptParsingResponse response) {
        if (!response.success() || !recordStore.isEnabled()) {
            return response;
        }
        try {
            String recordId = recordStore.save(response.receipt());
            LOGGER.info("Stored parsed receipt as record {}", recordId);
            return response;
        } catch (ReceiptStorageException ex) {
            LOGGER.error("Failed to store parsed receipt", ex);
            return response.withAdditionalError("Receipt could not be stored: " + ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected failure while storing parsed receipt", ex);
            return response.withAdditionalError("Receipt could not be stored: " + ex.getMessage());
        }
    }
}
