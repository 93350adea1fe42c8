package dev.pekelund.receipts.extraction;

import dev.pekelund.receipts.extraction.template.TemplateRegistry;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so we can verify the deployed templates and
 * thresholds.
 */
@Component
public class ReceiptExtractionDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReceiptExtractionDiagnostics.class);

    private final Environment environment;
    private final ReceiptExtractionSettings settings;
    private final TemplateRegistry templateRegistry;

    public ReceiptExtractionDiagnostics(Environment environment, ReceiptExtractionSettings settings,
        TemplateRegistry templateRegistry) {
        this.environment = environment;
        this.settings = settings;
        this.templateRegistry = templateRegistry;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Receipt extraction diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Registered receipt templates: {}", templateRegistry.describe());
        LOGGER.info("Template acceptance threshold: {}", settings.acceptanceThreshold());
        LOGGER.info("Vision retry: {}, language hints: {}", settings.visionRetry(), settings.languageHints());
        LOGGER.info("Field confidence policy: {}", settings.confidencePolicy());
        LOGGER.info("Scoring weights: {}", settings.scoringWeights());
        LOGGER.info("Receipt persistence enabled: {} (collection '{}')", settings.persistenceEnabled(),
            settings.persistenceCollection());
    }
}
