package com.example.jewelry_pricing.market;

/**
 * The external quantities the pricing engine depends on.
 */
public enum Market {

    /** 24K gold, INR per gram. */
    GOLD("gold"),

    /** INR per 1 USD. */
    USD_INR("fx");

    private final String metricTag;

    Market(String metricTag) {
        this.metricTag = metricTag;
    }

    public String metricTag() {
        return metricTag;
    }
}
