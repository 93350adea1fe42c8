package dev.pekelund.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentInfo(PaymentMethod method, String cardType, String cardLast4, String transactionId) {

    public PaymentInfo {
        Objects.requireNonNull(method, "method");
        if (cardLast4 != null && !cardLast4.matches("\\d{4}")) {
            throw new IllegalArgumentException("cardLast4 must contain exactly four digits");
        }
    }
}
