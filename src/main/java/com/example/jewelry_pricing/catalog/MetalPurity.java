package com.example.jewelry_pricing.catalog;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Purity and type multiplier derived from the metal's name ("18K Rose Gold", "Platinum").
 */
public final class MetalPurity {

    private static final Pattern KARAT = Pattern.compile("(\\d{2})\\s*(?:k|kt|karat|carat)\\b");

    static final BigDecimal DEFAULT_PURITY = new BigDecimal("0.75");

    private MetalPurity() {
    }

    public static MetalFactors fromName(String name) {
        String n = name == null ? "" : name.toLowerCase(Locale.ROOT);

        if (n.contains("platinum")) {
            return new MetalFactors(new BigDecimal("0.95"), new BigDecimal("1.4"));
        }

        BigDecimal purity = DEFAULT_PURITY;
        Matcher m = KARAT.matcher(n);
        if (m.find()) {
            purity = switch (m.group(1)) {
                case "24" -> new BigDecimal("1.0");
                case "22" -> new BigDecimal("0.916");
                case "18" -> new BigDecimal("0.75");
                case "14" -> new BigDecimal("0.585");
                default -> DEFAULT_PURITY;
            };
        }

        BigDecimal multiplier = BigDecimal.ONE;
        if (n.contains("white")) {
            multiplier = new BigDecimal("1.1");
        } else if (n.contains("rose")) {
            multiplier = new BigDecimal("1.05");
        }
        return new MetalFactors(purity, multiplier);
    }
}
