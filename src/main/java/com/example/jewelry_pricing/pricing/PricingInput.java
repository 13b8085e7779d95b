package com.example.jewelry_pricing.pricing;

import java.math.BigDecimal;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Everything {@link PriceCalculator} needs, already resolved against the catalog and the market
 * caches. A null metal or stone means "nothing selected".
 */
@Value
@Builder
public class PricingInput {
    MetalComponent metal;
    StoneComponent primaryStone;
    @Singular
    List<StoneComponent> secondaryStones;
    StoneComponent otherStone;

    BigDecimal goldPricePerGram; // INR, 24K
    BigDecimal exchangeRate; // INR per USD
}
