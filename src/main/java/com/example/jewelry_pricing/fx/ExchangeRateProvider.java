package com.example.jewelry_pricing.fx;

import java.math.BigDecimal;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.jewelry_pricing.market.Market;
import com.example.jewelry_pricing.market.MarketDataCache;
import com.example.jewelry_pricing.market.MarketDataEntry;
import com.example.jewelry_pricing.market.MarketDataMetrics;
import com.example.jewelry_pricing.market.MarketReading;
import com.example.jewelry_pricing.market.ReadingStatus;
import com.example.jewelry_pricing.market.RefreshResult;

/**
 * INR per USD. Falls back to the last good rate, then to the configured default rate.
 */
@Service
public class ExchangeRateProvider {

    private static final Logger log = LoggerFactory.getLogger(ExchangeRateProvider.class);

    private final MarketDataCache<BigDecimal> cache;
    private final MarketDataMetrics metrics;
    private final Clock clock;
    private final BigDecimal defaultRate;

    public ExchangeRateProvider(
            @Qualifier("exchangeRateCache") MarketDataCache<BigDecimal> cache,
            MarketDataMetrics metrics,
            Clock clock,
            @Value("${fx.default-rate:83}") BigDecimal defaultRate) {
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultRate = defaultRate;
    }

    public BigDecimal defaultRate() {
        return defaultRate;
    }

    /**
     * Non-blocking read used by pricing.
     */
    public MarketReading current() {
        MarketDataEntry<BigDecimal> entry = cache.peek().orElse(null);
        if (entry == null) {
            cache.refreshAsync();
            entry = cache.seedIfAbsent(defaultRate, ReadingStatus.DEFAULT.tag());
        } else {
            entry = cache.get().orElse(entry);
        }
        return served(entry);
    }

    /**
     * Read used by the exchange rate endpoint; waits for the first fetch on a cold cache.
     */
    public MarketReading lookup() {
        MarketDataEntry<BigDecimal> entry = cache.get()
                .orElseGet(() -> cache.seedIfAbsent(defaultRate, ReadingStatus.DEFAULT.tag()));
        return served(entry);
    }

    public MarketReading refresh() {
        log.info("Refreshing FX rate USD -> INR");
        RefreshResult<BigDecimal> result = cache.refresh();
        if (result.isSuccess()) {
            return served(result.entry());
        }
        metrics.incUpstreamError(Market.USD_INR.metricTag());
        log.warn("FX rate refresh failed ({}), serving fallback", result.error());
        MarketDataEntry<BigDecimal> fallback = result.entry() != null
                ? result.entry()
                : cache.seedIfAbsent(defaultRate, ReadingStatus.DEFAULT.tag());
        return served(fallback);
    }

    private MarketReading served(MarketDataEntry<BigDecimal> entry) {
        MarketReading reading = MarketReading.of(entry, clock.instant(), cache.ttl());
        metrics.incServed(Market.USD_INR.metricTag(), reading.status().tag());
        return reading;
    }
}
