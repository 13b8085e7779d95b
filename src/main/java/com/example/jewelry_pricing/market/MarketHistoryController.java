package com.example.jewelry_pricing.market;

import java.util.List;
import java.util.Locale;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.jewelry_pricing.entity.MarketRateHistory;

import lombok.RequiredArgsConstructor;

/**
 * Recent refreshes per market, newest first.
 */
@RestController
@RequestMapping("/api/market-history")
@RequiredArgsConstructor
public class MarketHistoryController {

    private final MarketRateHistoryService historyService;

    @GetMapping("/{market}")
    public List<MarketRateHistory> history(@PathVariable String market) {
        return historyService.latest(parse(market));
    }

    @GetMapping("/anomalies")
    public List<MarketRateHistory> anomalies() {
        return historyService.anomalies();
    }

    static Market parse(String market) {
        String key = market == null ? "" : market.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "gold", "gold-price" -> Market.GOLD;
            case "fx", "usd-inr", "exchange-rate" -> Market.USD_INR;
            default -> throw new IllegalArgumentException("Unknown market: " + market);
        };
    }
}
