package dev.pekelund.receipts.extraction.pipeline;

import dev.pekelund.receipts.extraction.assembly.ReceiptAssembler;
import dev.pekelund.receipts.extraction.assembly.ReceiptParsingResponse;
import dev.pekelund.receipts.extraction.extract.ExtractedReceipt;
import dev.pekelund.receipts.extraction.extract.RegionConfidence;
import dev.pekelund.receipts.extraction.ocr.RawOcrResult;
import dev.pekelund.receipts.extraction.sanitize.ReceiptTextSanitizer;
import dev.pekelund.receipts.extraction.sanitize.SanitizedText;
import dev.pekelund.receipts.extraction.scoring.ConfidenceReport;
import dev.pekelund.receipts.extraction.scoring.ConfidenceScorer;
import dev.pekelund.receipts.extraction.template.TemplateDetector;
import dev.pekelund.receipts.extraction.template.TemplateMatch;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the synchronous stages that follow OCR: sanitize, detect the template, extract fields,
 * score and assemble. Holds no per-request state and may be shared between threads.
 */
public class ReceiptParsingPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptParsingPipeline.class);

    private final ReceiptTextSanitizer sanitizer;
    private final TemplateDetector templateDetector;
    private final ConfidenceScorer confidenceScorer;
    private final ReceiptAssembler assembler;

    public ReceiptParsingPipeline(ReceiptTextSanitizer sanitizer, TemplateDetector templateDetector,
        ConfidenceScorer confidenceScorer, ReceiptAssembler assembler) {
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.templateDetector = Objects.requireNonNull(templateDetector, "templateDetector");
        this.confidenceScorer = Objects.requireNonNull(confidenceScorer, "confidenceScorer");
        this.assembler = Objects.requireNonNull(assembler, "assembler");
    }

    /**
     * Processes recognised text. Throws {@link dev.pekelund.receipts.extraction.sanitize.SanitizationException}
     * when the text is malformed; every later outcome is reported through the response.
     */
    public ReceiptParsingResponse process(RawOcrResult ocrResult) {
        Objects.requireNonNull(ocrResult, "ocrResult");
        PipelineProgress progress = new PipelineProgress(PipelineStage.OCR_COMPLETE);
        SanitizedText text = sanitizer.sanitize(ocrResult.text());
        progress.advanceTo(PipelineStage.SANITIZED);
        return processSanitized(text, RegionConfidence.from(ocrResult.regions()), progress);
    }

    /**
     * Processes UTF-8 encoded text supplied without OCR.
     */
    public ReceiptParsingResponse processText(byte[] encodedText) {
        PipelineProgress progress = new PipelineProgress();
        SanitizedText text = sanitizer.sanitize(encodedText);
        progress.advanceTo(PipelineStage.SANITIZED);
        return processSanitized(text, RegionConfidence.NONE, progress);
    }

    private ReceiptParsingResponse processSanitized(SanitizedText text, RegionConfidence regions,
        PipelineProgress progress) {
        LOGGER.info("Sanitized receipt text into {} lines", text.lines().size());

        TemplateMatch match = templateDetector.detect(text);
        ReceiptProcessingMdc.attachTemplate(match.templateId());
        progress.advanceTo(PipelineStage.TEMPLATE_SELECTED);
        LOGGER.info("Selected template '{}' (score {}, fallback {})", match.templateId(), match.score(),
            match.fallback());

        ExtractedReceipt extracted = match.template().extractor().extract(text, regions);
        progress.advanceTo(PipelineStage.FIELDS_EXTRACTED);

        ConfidenceReport report = confidenceScorer.score(extracted);
        progress.advanceTo(PipelineStage.SCORED);

        ReceiptParsingResponse response = assembler.assemble(text, extracted, report);
        progress.advanceTo(PipelineStage.ASSEMBLED);
        LOGGER.info("Receipt parsing finished with success={} and {} messages", response.success(),
            response.errors().size());
        return response;
    }
}
