package com.example.jewelry_pricing.gold;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The default extraction chain, strictest first.
 */
public final class GoldPriceExtractors {

    private static final String KARAT_24 = "24\\s*(?:K|KT|Karat|Carat)\\b";
    private static final String RUPEE = "(?:\u20B9|Rs\\.?|INR)";
    private static final String AMOUNT = "([\\d,]+(?:\\.\\d+)?)";

    static final Pattern PER_GRAM = Pattern.compile(
            KARAT_24 + "[^\\d\u20B9]{0,80}" + RUPEE + "\\s*" + AMOUNT + "\\s*(?:/|per)\\s*(?:1\\s*)?(?:g|gm|gram)\\b",
            Pattern.CASE_INSENSITIVE);

    static final Pattern PER_TEN_GRAMS = Pattern.compile(
            KARAT_24 + "[^\\d\u20B9]{0,80}" + RUPEE + "\\s*" + AMOUNT + "\\s*(?:/|per)\\s*10\\s*(?:g|gm|grams?)\\b",
            Pattern.CASE_INSENSITIVE);

    static final Pattern ANY_RUPEE_AMOUNT = Pattern.compile(
            RUPEE + "\\s*([\\d,]{4,9}(?:\\.\\d+)?)",
            Pattern.CASE_INSENSITIVE);

    private GoldPriceExtractors() {
    }

    public static List<GoldPriceExtractor> defaultChain(ObjectMapper objectMapper) {
        return List.of(
                new JsonFieldGoldPriceExtractor(objectMapper,
                        List.of("price_per_gram_inr", "price_gram_24k", "gold_24k_per_gram")),
                new RegexGoldPriceExtractor("labelled-per-gram", PER_GRAM, BigDecimal.ONE),
                new RegexGoldPriceExtractor("labelled-per-10g", PER_TEN_GRAMS, BigDecimal.TEN),
                new RegexGoldPriceExtractor("loose-rupee-amount", ANY_RUPEE_AMOUNT, BigDecimal.ONE));
    }
}
