package com.example.jewelry_pricing.client;

public class PriceRequestFailedException extends RuntimeException {

    public PriceRequestFailedException(String message) {
        super(message);
    }

    public PriceRequestFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
