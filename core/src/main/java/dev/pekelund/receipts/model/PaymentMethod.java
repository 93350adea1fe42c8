package dev.pekelund.receipts.model;

public enum PaymentMethod {
    CASH,
    CREDIT,
    DEBIT,
    DIGITAL
}
