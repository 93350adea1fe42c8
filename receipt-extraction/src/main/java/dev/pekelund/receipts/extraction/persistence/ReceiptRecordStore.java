package dev.pekelund.receipts.extraction.persistence;

import dev.pekelund.receipts.model.Receipt;

/**
 * Storage collaborator for assembled receipts.
 */
public interface ReceiptRecordStore {

    boolean isEnabled();

    /**
     * Stores the receipt and returns the identifier of the written record.
     *
     * @throws ReceiptStorageException when the record could not be written
     */
    String save(Receipt receipt);
}
