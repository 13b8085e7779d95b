package com.example.jewelry_pricing.pricing;

import java.util.Map;

import com.example.jewelry_pricing.market.MarketReading;

/**
 * A quote plus what it was computed from.
 */
public record PricingResult(
        PriceQuote quote,
        Map<String, Object> inputs,
        MarketReading goldPrice,
        MarketReading exchangeRate) {
}
