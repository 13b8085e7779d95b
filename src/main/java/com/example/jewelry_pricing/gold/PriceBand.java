package com.example.jewelry_pricing.gold;

import java.math.BigDecimal;

/**
 * Plausible range for 24K gold in INR per gram. Anything outside is treated as a parse error.
 */
public record PriceBand(BigDecimal min, BigDecimal max) {

    public PriceBand {
        if (min == null || max == null || min.compareTo(max) > 0) {
            throw new IllegalArgumentException("invalid price band: " + min + ".." + max);
        }
    }

    public boolean contains(BigDecimal value) {
        return value != null && value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }
}
