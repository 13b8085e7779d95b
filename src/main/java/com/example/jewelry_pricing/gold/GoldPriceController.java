package com.example.jewelry_pricing.gold;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.jewelry_pricing.market.MarketReading;

import lombok.RequiredArgsConstructor;

/**
 * Current 24K gold price per gram (INR).
 */
@RestController
@RequestMapping("/api/gold-price")
@RequiredArgsConstructor
public class GoldPriceController {

    private static final Logger log = LoggerFactory.getLogger(GoldPriceController.class);

    private final GoldPriceProvider goldPriceProvider;

    @GetMapping
    public ResponseEntity<?> getGoldPrice() {
        try {
            return ResponseEntity.ok(body(goldPriceProvider.lookup()));
        } catch (RuntimeException e) {
            log.error("Error serving gold price", e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "success", false,
                    "error", e.getMessage() != null ? e.getMessage() : "Unknown error"));
        }
    }

    /**
     * Fetches now instead of waiting for the schedule. A failed fetch still answers with the
     * fallback value.
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> refreshGoldPrice() {
        MarketReading reading = goldPriceProvider.refresh();
        Map<String, Object> body = body(reading);
        body.put("refreshed", !reading.status().isFallback());
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> body(MarketReading reading) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("price", reading.value());
        body.put("timestamp", reading.timestamp().toEpochMilli());
        body.put("location", goldPriceProvider.location());
        body.put("source", reading.source());
        body.put("status", reading.status().tag());
        return body;
    }
}
