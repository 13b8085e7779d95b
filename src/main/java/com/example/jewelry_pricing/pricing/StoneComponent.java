package com.example.jewelry_pricing.pricing;

import java.math.BigDecimal;

/**
 * A stone selection with its catalog price already resolved.
 */
public record StoneComponent(String name, BigDecimal caratWeight, BigDecimal pricePerCarat) {
}
