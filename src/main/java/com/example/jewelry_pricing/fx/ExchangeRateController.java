package com.example.jewelry_pricing.fx;

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
 * USD to INR exchange rate endpoints.
 */
@RestController
@RequestMapping("/api/exchange-rate")
@RequiredArgsConstructor
public class ExchangeRateController {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRateController.class);

    private final ExchangeRateProvider exchangeRateProvider;

    /**
     * Current rate. Falls back to the cached or default rate, so this only fails on an
     * internal error, and even then reports the default rate.
     */
    @GetMapping
    public ResponseEntity<?> getRate() {
        try {
            return ResponseEntity.ok(body(exchangeRateProvider.lookup()));
        } catch (RuntimeException e) {
            log.error("Error in exchange rate endpoint", e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "success", false,
                    "error", "Failed to fetch exchange rate",
                    "fallbackRate", exchangeRateProvider.defaultRate()));
        }
    }

    @PostMapping("/refresh")
    public ResponseEntity<?> refreshRate() {
        MarketReading reading = exchangeRateProvider.refresh();
        Map<String, Object> body = body(reading);
        body.put("refreshed", !reading.status().isFallback());
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> body(MarketReading reading) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("rate", reading.value());
        body.put("source", reading.source());
        body.put("status", reading.status().tag());
        body.put("timestamp", reading.timestamp().toString());
        if (reading.status().isFallback()) {
            body.put("fallbackRate", exchangeRateProvider.defaultRate());
        }
        return body;
    }
}
