package dev.pekelund.receipts.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Store(String name, String address, String phone, String website, String taxId) {

    public Store {
        Objects.requireNonNull(name, "name");
    }

    public static Store named(String name) {
        return new Store(name, null, null, null, null);
    }
}
