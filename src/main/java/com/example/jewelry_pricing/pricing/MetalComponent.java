package com.example.jewelry_pricing.pricing;

import java.math.BigDecimal;

/**
 * A metal selection with its catalog factors already resolved.
 */
public record MetalComponent(String name, BigDecimal weightGrams, BigDecimal purityFactor, BigDecimal typeMultiplier) {
}
