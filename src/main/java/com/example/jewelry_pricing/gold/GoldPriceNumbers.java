package com.example.jewelry_pricing.gold;

import java.math.BigDecimal;

final class GoldPriceNumbers {

    private GoldPriceNumbers() {
    }

    /**
     * "9,812.50" -> 9812.50. Returns null for anything that is not a plain positive number.
     */
    static BigDecimal parse(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            BigDecimal value = new BigDecimal(cleaned);
            return value.signum() > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
