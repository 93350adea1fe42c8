package dev.pekelund.receipts.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import dev.pekelund.receipts.extraction.assembly.ReceiptAssembler;
import dev.pekelund.receipts.extraction.extract.FieldConfidencePolicy;
import dev.pekelund.receipts.extraction.ocr.GoogleCloudVisionClient;
import dev.pekelund.receipts.extraction.ocr.VisionAdapter;
import dev.pekelund.receipts.extraction.ocr.VisionClient;
import dev.pekelund.receipts.extraction.persistence.DisabledReceiptRecordStore;
import dev.pekelund.receipts.extraction.persistence.FirestoreReceiptRecordStore;
import dev.pekelund.receipts.extraction.persistence.ReceiptRecordStore;
import dev.pekelund.receipts.extraction.pipeline.ReceiptParsingPipeline;
import dev.pekelund.receipts.extraction.pipeline.ReceiptParsingService;
import dev.pekelund.receipts.extraction.sanitize.JsoupMarkupStripper;
import dev.pekelund.receipts.extraction.sanitize.MarkupStripper;
import dev.pekelund.receipts.extraction.sanitize.ReceiptTextSanitizer;
import dev.pekelund.receipts.extraction.scoring.ConfidenceScorer;
import dev.pekelund.receipts.extraction.template.TemplateDetector;
import dev.pekelund.receipts.extraction.template.TemplateRegistry;
import dev.pekelund.receipts.extraction.template.TemplateRegistryLoader;
import io.micrometer.observation.ObservationRegistry;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

/**
 * Wires the receipt extraction pipeline. The Vision client is created lazily on the first OCR
 * request so the service starts without Google Cloud credentials.
 */
@Configuration
public class ReceiptExtractionConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptExtractionConfiguration.class);

    @Bean
    public ReceiptExtractionSettings receiptExtractionSettings(Environment environment) {
        return ReceiptExtractionSettings.fromEnvironment(environment);
    }

    @Bean
    public Clock receiptClock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public MarkupStripper markupStripper() {
        return new JsoupMarkupStripper();
    }

    @Bean
    public ReceiptTextSanitizer receiptTextSanitizer(MarkupStripper markupStripper,
        ReceiptExtractionSettings settings) {
        return new ReceiptTextSanitizer(markupStripper, settings.sanitizerMaxLength());
    }

    @Bean
    public FieldConfidencePolicy fieldConfidencePolicy(ReceiptExtractionSettings settings) {
        return settings.confidencePolicy();
    }

    @Bean
    public TemplateRegistry templateRegistry(ObjectMapper objectMapper, ResourceLoader resourceLoader,
        FieldConfidencePolicy fieldConfidencePolicy, ReceiptExtractionSettings settings) {
        LOGGER.info("Loading receipt templates from {}", settings.templatesLocation());
        TemplateRegistryLoader loader = new TemplateRegistryLoader(objectMapper, fieldConfidencePolicy);
        return loader.load(resourceLoader.getResource(settings.templatesLocation()));
    }

    @Bean
    public TemplateDetector templateDetector(TemplateRegistry templateRegistry, ReceiptExtractionSettings settings) {
        return new TemplateDetector(templateRegistry, settings.acceptanceThreshold());
    }

    @Bean
    public ConfidenceScorer confidenceScorer(ReceiptExtractionSettings settings) {
        return new ConfidenceScorer(settings.scoringWeights());
    }

    @Bean
    public ReceiptAssembler receiptAssembler(Clock receiptClock, ReceiptExtractionSettings settings) {
        return new ReceiptAssembler(receiptClock, settings.scoringWeights().missingTotalsPenalty());
    }

    @Bean
    public ReceiptParsingPipeline receiptParsingPipeline(ReceiptTextSanitizer receiptTextSanitizer,
        TemplateDetector templateDetector, ConfidenceScorer confidenceScorer, ReceiptAssembler receiptAssembler) {
        return new ReceiptParsingPipeline(receiptTextSanitizer, templateDetector, confidenceScorer, receiptAssembler);
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public ImageAnnotatorClient imageAnnotatorClient() {
        try {
            ImageAnnotatorClient client = ImageAnnotatorClient.create();
            LOGGER.info("Initialized Google Cloud Vision client");
            return client;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to create Google Cloud Vision client", ex);
        }
    }

    @Bean
    public VisionClient visionClient(ObjectProvider<ImageAnnotatorClient> imageAnnotatorClient,
        ReceiptExtractionSettings settings) {
        return new GoogleCloudVisionClient(imageAnnotatorClient::getObject, settings.languageHints());
    }

    @Bean
    public VisionAdapter visionAdapter(VisionClient visionClient, ReceiptExtractionSettings settings,
        ObjectProvider<ObservationRegistry> observationRegistry) {
        return new VisionAdapter(visionClient, settings.visionRetry(),
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    @ConditionalOnProperty(value = "receipts.persistence.enabled", havingValue = "true")
    public Firestore firestore(ReceiptExtractionSettings settings) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(settings.projectId())) {
            optionsBuilder.setProjectId(settings.projectId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' (target collection '{}')",
            firestore.getOptions().getProjectId(), settings.persistenceCollection());
        return firestore;
    }

    @Bean
    @ConditionalOnProperty(value = "receipts.persistence.enabled", havingValue = "true")
    public ReceiptRecordStore firestoreReceiptRecordStore(Firestore firestore, ReceiptExtractionSettings settings) {
        return new FirestoreReceiptRecordStore(firestore, settings.persistenceCollection());
    }

    @Bean
    @ConditionalOnProperty(value = "receipts.persistence.enabled", havingValue = "false", matchIfMissing = true)
    public ReceiptRecordStore disabledReceiptRecordStore() {
        return new DisabledReceiptRecordStore();
    }

    @Bean
    public ReceiptParsingService receiptParsingService(VisionAdapter visionAdapter,
        ReceiptParsingPipeline receiptParsingPipeline, ReceiptRecordStore receiptRecordStore) {
        return new ReceiptParsingService(visionAdapter, receiptParsingPipeline, receiptRecordStore);
    }
}
