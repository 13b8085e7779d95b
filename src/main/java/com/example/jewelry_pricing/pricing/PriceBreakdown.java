package com.example.jewelry_pricing.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.function.UnaryOperator;

/**
 * Cost components of one quote in a single currency.
 */
public record PriceBreakdown(
        BigDecimal metalCost,
        BigDecimal primaryStoneCost,
        BigDecimal secondaryStoneCost,
        BigDecimal otherStoneCost,
        BigDecimal overhead) {

    public static final PriceBreakdown ZERO = new PriceBreakdown(
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    public BigDecimal materialCost() {
        return metalCost.add(primaryStoneCost).add(secondaryStoneCost).add(otherStoneCost);
    }

    public BigDecimal total() {
        return materialCost().add(overhead);
    }

    /**
     * Applies {@code fn} to every component.
     */
    public PriceBreakdown map(UnaryOperator<BigDecimal> fn) {
        return new PriceBreakdown(
                fn.apply(metalCost),
                fn.apply(primaryStoneCost),
                fn.apply(secondaryStoneCost),
                fn.apply(otherStoneCost),
                fn.apply(overhead));
    }

    static BigDecimal wholeUnits(BigDecimal v) {
        return v.setScale(0, RoundingMode.HALF_UP);
    }
}
