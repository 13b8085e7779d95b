package com.example.jewelry_pricing.pricing;

/**
 * A calculation aborted for a reason other than bad input. Callers get a generic failure.
 */
public class PricingCalculationException extends RuntimeException {

    public PricingCalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
