package dev.pekelund.receipts.extraction.scoring;

import java.math.BigDecimal;

/**
 * Result of comparing {@code subtotal + tax - discount} with the extracted total. {@code difference}
 * is {@code null} unless the check ran.
 */
public record Reconciliation(Status status, BigDecimal difference) {

    public static final Reconciliation NOT_CHECKED = new Reconciliation(Status.NOT_CHECKED, null);

    public boolean isMismatch() {
        return status == Status.MISMATCH;
    }

    public enum Status {
        BALANCED,
        MISMATCH,
        NOT_CHECKED
    }
}
