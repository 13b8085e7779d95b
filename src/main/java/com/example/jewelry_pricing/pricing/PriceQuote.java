package com.example.jewelry_pricing.pricing;

/**
 * One quote in both currencies. The USD side is always derived from the INR side.
 */
public record PriceQuote(CurrencyQuote inr, CurrencyQuote usd) {
}
