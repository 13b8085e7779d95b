package com.example.jewelry_pricing.pricing;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.jewelry_pricing.dto.CalculatePriceRequest;
import com.example.jewelry_pricing.market.MarketReading;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
public class PricingController {

    private final PricingService pricingService;

    @PostMapping("/calculate-price")
    public ResponseEntity<Map<String, Object>> calculatePrice(@Valid @RequestBody CalculatePriceRequest req) {
        PricingResult result = pricingService.calculate(req);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("usd", result.quote().usd());
        body.put("inr", result.quote().inr());
        body.put("inputs", result.inputs());

        Map<String, Object> market = new LinkedHashMap<>();
        market.put("goldPrice", marketInfo(result.goldPrice()));
        market.put("exchangeRate", marketInfo(result.exchangeRate()));
        body.put("market", market);
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> marketInfo(MarketReading r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("value", r.value());
        m.put("source", r.source());
        m.put("status", r.status().tag());
        m.put("timestamp", r.timestamp().toString());
        return m;
    }
}
