package com.example.jewelry_pricing.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import org.springframework.stereotype.Component;

/**
 * Pure pricing arithmetic. No I/O, no clock, no randomness: identical input gives identical
 * output.
 *
 * <ul>
 * <li>metal = weight x gold price x purity x type multiplier</li>
 * <li>stone = carats x price per carat</li>
 * <li>overhead = 25% of metal + stones (craftsmanship)</li>
 * </ul>
 *
 * INR components are rounded to whole rupees before the overhead is taken, so the breakdown
 * always adds up to the total exactly. USD is each INR figure divided by the rate and rounded.
 */
@Component
public class PriceCalculator {

    public static final BigDecimal OVERHEAD_RATE = new BigDecimal("0.25");
    public static final String INR = "INR";
    public static final String USD = "USD";

    public PriceQuote calculate(PricingInput in) {
        BigDecimal goldPrice = nz(in.getGoldPricePerGram());
        BigDecimal rate = in.getExchangeRate();
        // market values come from the caches, so a bad one is an internal failure
        if (goldPrice.signum() < 0) {
            throw new IllegalStateException("gold price must not be negative: " + goldPrice);
        }
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalStateException("exchange rate must be positive: " + rate);
        }

        BigDecimal metalCost = metalCost(in.getMetal(), goldPrice);
        BigDecimal primary = stoneCost(in.getPrimaryStone());
        BigDecimal secondary = secondaryCost(in.getSecondaryStones());
        BigDecimal other = stoneCost(in.getOtherStone());

        BigDecimal material = metalCost.add(primary).add(secondary).add(other);
        BigDecimal overhead = PriceBreakdown.wholeUnits(material.multiply(OVERHEAD_RATE));

        PriceBreakdown inrBreakdown = new PriceBreakdown(metalCost, primary, secondary, other, overhead);
        CurrencyQuote inr = new CurrencyQuote(inrBreakdown.total(), INR, inrBreakdown);
        CurrencyQuote usd = new CurrencyQuote(
                toUsd(inr.price(), rate), USD, inrBreakdown.map(v -> toUsd(v, rate)));
        return new PriceQuote(inr, usd);
    }

    private BigDecimal metalCost(MetalComponent metal, BigDecimal goldPrice) {
        if (metal == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal weight = nonNegative(metal.weightGrams(), "metal weight");
        BigDecimal purity = metal.purityFactor();
        BigDecimal multiplier = metal.typeMultiplier();
        if (purity == null || multiplier == null || purity.multiply(multiplier).signum() <= 0) {
            throw new IllegalStateException("metal '" + metal.name() + "' has no usable purity/multiplier");
        }
        return PriceBreakdown.wholeUnits(weight.multiply(goldPrice).multiply(purity).multiply(multiplier));
    }

    private BigDecimal stoneCost(StoneComponent stone) {
        if (stone == null) {
            return BigDecimal.ZERO;
        }
        return PriceBreakdown.wholeUnits(rawStoneCost(stone));
    }

    private BigDecimal secondaryCost(List<StoneComponent> stones) {
        BigDecimal sum = BigDecimal.ZERO;
        if (stones != null) {
            for (StoneComponent s : stones) {
                if (s != null) {
                    sum = sum.add(rawStoneCost(s));
                }
            }
        }
        return PriceBreakdown.wholeUnits(sum);
    }

    private BigDecimal rawStoneCost(StoneComponent stone) {
        BigDecimal carats = nonNegative(stone.caratWeight(), "carat weight of " + stone.name());
        BigDecimal perCarat = nonNegative(stone.pricePerCarat(), "price per carat of " + stone.name());
        return carats.multiply(perCarat);
    }

    private static BigDecimal toUsd(BigDecimal inr, BigDecimal rate) {
        return inr.divide(rate, 0, RoundingMode.HALF_UP);
    }

    private static BigDecimal nonNegative(BigDecimal v, String what) {
        BigDecimal value = nz(v);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(what + " must not be negative: " + value);
        }
        return value;
    }

    private static BigDecimal nz(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }
}
