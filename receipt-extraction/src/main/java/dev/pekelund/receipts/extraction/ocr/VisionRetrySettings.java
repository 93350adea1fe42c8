package dev.pekelund.receipts.extraction.ocr;

import java.time.Duration;
import java.util.Objects;

public record VisionRetrySettings(int maxAttempts, Duration initialBackoff, double backoffMultiplier,
    Duration maxBackoff) {

    public static final VisionRetrySettings DEFAULTS = new VisionRetrySettings(3, Duration.ofMillis(200), 2.0,
        Duration.ofSeconds(2));

    public VisionRetrySettings {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
        }
    }
}
