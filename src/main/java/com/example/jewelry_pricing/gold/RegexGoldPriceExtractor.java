package com.example.jewelry_pricing.gold;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads prices with a pattern whose first group is the amount. {@code gramsPerQuote} converts
 * quotes such as "per 10 grams" to a per-gram value.
 */
public class RegexGoldPriceExtractor implements GoldPriceExtractor {

    private final String name;
    private final Pattern pattern;
    private final BigDecimal gramsPerQuote;

    public RegexGoldPriceExtractor(String name, Pattern pattern, BigDecimal gramsPerQuote) {
        if (gramsPerQuote == null || gramsPerQuote.signum() <= 0) {
            throw new IllegalArgumentException("gramsPerQuote must be positive");
        }
        this.name = name;
        this.pattern = pattern;
        this.gramsPerQuote = gramsPerQuote;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<BigDecimal> candidates(String body) {
        List<BigDecimal> out = new ArrayList<>();
        Matcher m = pattern.matcher(body);
        while (m.find()) {
            BigDecimal amount = GoldPriceNumbers.parse(m.group(1));
            if (amount != null) {
                out.add(amount.divide(gramsPerQuote, 2, RoundingMode.HALF_UP));
            }
        }
        return out;
    }
}
