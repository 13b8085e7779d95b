package com.example.jewelry_pricing.catalog;

/**
 * A metal or stone id that matches no catalog row. Reported to the caller as invalid input.
 */
public class UnknownCatalogItemException extends IllegalArgumentException {

    private final String kind;
    private final String requestedId;

    public UnknownCatalogItemException(String kind, String requestedId) {
        super("Unknown " + kind + ": " + requestedId);
        this.kind = kind;
        this.requestedId = requestedId;
    }

    public String getKind() {
        return kind;
    }

    public String getRequestedId() {
        return requestedId;
    }
}
