package com.example.jewelry_pricing.gold;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a structured JSON response, e.g. {@code {"price_per_gram_inr": 9812.5}}. Field names are
 * searched at any depth in the given order.
 */
public class JsonFieldGoldPriceExtractor implements GoldPriceExtractor {

    private final ObjectMapper objectMapper;
    private final List<String> fieldNames;

    public JsonFieldGoldPriceExtractor(ObjectMapper objectMapper, List<String> fieldNames) {
        this.objectMapper = objectMapper;
        this.fieldNames = List.copyOf(fieldNames);
    }

    @Override
    public String name() {
        return "json";
    }

    @Override
    public List<BigDecimal> candidates(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return List.of();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return List.of();
        }

        List<BigDecimal> out = new ArrayList<>();
        for (String field : fieldNames) {
            for (JsonNode node : root.findValues(field)) {
                BigDecimal value = toDecimal(node);
                if (value != null) {
                    out.add(value);
                }
            }
        }
        return out;
    }

    private static BigDecimal toDecimal(JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            return GoldPriceNumbers.parse(node.asText());
        }
        return null;
    }
}
