package dev.pekelund.receipts.extraction.pipeline;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates mapped diagnostic context (MDC) entries so log lines emitted while a receipt moves
 * through the pipeline share the same source, template and stage.
 */
final class ReceiptProcessingMdc {

    static final String KEY_SOURCE = "receipt.source";
    static final String KEY_TEMPLATE = "receipt.template";
    static final String KEY_STAGE = "receipt.stage";

    private ReceiptProcessingMdc() {
        // Utility class
    }

    static Context open(String source) {
        return new Context(source);
    }

    static void attachTemplate(String templateId) {
        putIfHasText(KEY_TEMPLATE, templateId);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String source) {
            this.previous = MDC.getCopyOfContextMap();
            putIfHasText(KEY_SOURCE, source);
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
