package com.example.jewelry_pricing.catalog;

import java.math.BigDecimal;

public record MetalFactors(BigDecimal purityFactor, BigDecimal typeMultiplier) {

    public BigDecimal combined() {
        return purityFactor.multiply(typeMultiplier);
    }
}
