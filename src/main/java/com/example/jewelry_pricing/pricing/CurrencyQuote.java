package com.example.jewelry_pricing.pricing;

import java.math.BigDecimal;

public record CurrencyQuote(BigDecimal price, String currency, PriceBreakdown breakdown) {
}
