package dev.pekelund.receipts.extraction.persistence;

import dev.pekelund.receipts.model.Receipt;

public class DisabledReceiptRecordStore implements ReceiptRecordStore {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public String save(Receipt receipt) {
        throw new ReceiptStorageException("Receipt persistence is disabled");
    }
}
