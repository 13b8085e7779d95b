package com.example.jewelry_pricing.ops;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.jewelry_pricing.market.MarketDataCache;
import com.example.jewelry_pricing.market.MarketDataEntry;

@RestController
@RequestMapping("/health")
public class HealthController {

    private final MarketDataCache<BigDecimal> goldPriceCache;
    private final MarketDataCache<BigDecimal> exchangeRateCache;
    private final Clock clock;

    public HealthController(
            @Qualifier("goldPriceCache") MarketDataCache<BigDecimal> goldPriceCache,
            @Qualifier("exchangeRateCache") MarketDataCache<BigDecimal> exchangeRateCache,
            Clock clock) {
        this.goldPriceCache = goldPriceCache;
        this.exchangeRateCache = exchangeRateCache;
        this.clock = clock;
    }

    /**
     * Always UP while the process serves requests; stale market data degrades prices, not
     * availability.
     */
    @GetMapping
    public ResponseEntity<?> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("timestamp", clock.instant().toString());
        body.put("goldPrice", cacheInfo(goldPriceCache));
        body.put("exchangeRate", cacheInfo(exchangeRateCache));
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> cacheInfo(MarketDataCache<BigDecimal> cache) {
        Map<String, Object> m = new LinkedHashMap<>();
        MarketDataEntry<BigDecimal> entry = cache.peek().orElse(null);
        if (entry == null) {
            m.put("state", "EMPTY");
            return m;
        }
        m.put("state", cache.isStale() ? "STALE" : "FRESH");
        m.put("value", entry.value());
        m.put("source", entry.source());
        m.put("ageSeconds", entry.age(clock.instant()).toSeconds());
        return m;
    }
}
