package dev.pekelund.receipts.extraction.ocr;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.support.RetryTemplate;

/**
 * Wraps the {@link VisionClient} with bounded exponential retry for transient failures. Permanent
 * failures surface on the first attempt.
 */
public class VisionAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(VisionAdapter.class);

    private final VisionClient visionClient;
    private final RetryTemplate retryTemplate;
    private final ObservationRegistry observationRegistry;

    public VisionAdapter(VisionClient visionClient, VisionRetrySettings retrySettings,
        ObservationRegistry observationRegistry) {
        this(visionClient, retrySettings, observationRegistry, new ThreadWaitSleeper());
    }

    VisionAdapter(VisionClient visionClient, VisionRetrySettings retrySettings,
        ObservationRegistry observationRegistry, Sleeper sleeper) {
        this.visionClient = Objects.requireNonNull(visionClient, "visionClient");
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
        this.retryTemplate = buildRetryTemplate(Objects.requireNonNull(retrySettings, "retrySettings"), sleeper);
    }

    public RawOcrResult recognize(ImagePayload image) {
        Objects.requireNonNull(image, "image");
        Observation observation = Observation.start("receipt.vision.ocr", observationRegistry)
            .lowCardinalityKeyValue("source", image.isReference() ? "uri" : "bytes");
        try (Observation.Scope scope = observation.openScope()) {
            RawOcrResult result = retryTemplate.execute(context -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw new OcrServiceException("OCR request was cancelled");
                }
                return visionClient.detectText(image);
            });
            LOGGER.info("Recognised {} characters in {} regions for {}", result.text().length(),
                result.regions().size(), image.describe());
            return result;
        } catch (BackOffInterruptedException ex) {
            Thread.currentThread().interrupt();
            OcrServiceException cancelled = new OcrServiceException("OCR request was cancelled", ex);
            observation.error(cancelled);
            throw cancelled;
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private static RetryTemplate buildRetryTemplate(VisionRetrySettings settings, Sleeper sleeper) {
        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(settings.initialBackoff().toMillis());
        backOffPolicy.setMultiplier(settings.backoffMultiplier());
        backOffPolicy.setMaxInterval(settings.maxBackoff().toMillis());
        backOffPolicy.setSleeper(sleeper);

        return RetryTemplate.builder()
            .maxAttempts(settings.maxAttempts())
            .retryOn(TransientOcrServiceException.class)
            .customBackoff(backOffPolicy)
            .withListener(new RetryListener() {
                @Override
                public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                    Throwable throwable) {
                    LOGGER.warn("OCR attempt {} of {} failed: {}", context.getRetryCount(), settings.maxAttempts(),
                        throwable.getMessage());
                }
            })
            .build();
    }
}
