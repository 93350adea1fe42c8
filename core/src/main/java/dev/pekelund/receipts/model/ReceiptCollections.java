package dev.pekelund.receipts.model;

/**
 * Shared constants describing the Firestore layout used for assembled receipts.
 */
public final class ReceiptCollections {

    /**
     * Default Firestore collection containing assembled receipt documents.
     */
    public static final String DEFAULT_RECEIPTS_COLLECTION = "receipts";

    private ReceiptCollections() {
    }
}
