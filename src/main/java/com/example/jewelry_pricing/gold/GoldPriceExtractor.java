package com.example.jewelry_pricing.gold;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * One way of reading a 24K price per gram out of a market page. Extractors are tried in order
 * by {@link GoldPriceSource}.
 */
public interface GoldPriceExtractor {

    String name();

    /**
     * All values this extractor can read from the body, in document order, already converted to
     * INR per gram.
     */
    List<BigDecimal> candidates(String body);

    default Optional<BigDecimal> extract(String body, PriceBand band) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        return candidates(body).stream().filter(band::contains).findFirst();
    }
}
