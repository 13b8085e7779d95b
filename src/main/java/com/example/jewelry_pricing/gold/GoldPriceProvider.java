package com.example.jewelry_pricing.gold;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
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
 * 24K gold price in INR per gram for the configured location.
 *
 * <p>Fallback chain: live value, then the last good value, then an estimate around the configured
 * baseline. The estimate is stored in the cache so every consumer sees the same number until a
 * real fetch succeeds.
 */
@Service
public class GoldPriceProvider {

    private static final Logger log = LoggerFactory.getLogger(GoldPriceProvider.class);

    private final MarketDataCache<BigDecimal> cache;
    private final MarketDataMetrics metrics;
    private final Clock clock;
    private final String location;
    private final BigDecimal baseline;
    private final BigDecimal jitter;
    private final Random random;

    @Autowired
    public GoldPriceProvider(
            @Qualifier("goldPriceCache") MarketDataCache<BigDecimal> cache,
            MarketDataMetrics metrics,
            Clock clock,
            @Value("${gold.location:Hyderabad, India}") String location,
            @Value("${gold.baseline-inr-per-gram:9800}") BigDecimal baseline,
            @Value("${gold.estimate-jitter-inr:150}") BigDecimal jitter) {
        this(cache, metrics, clock, location, baseline, jitter, new Random());
    }

    GoldPriceProvider(MarketDataCache<BigDecimal> cache, MarketDataMetrics metrics, Clock clock,
            String location, BigDecimal baseline, BigDecimal jitter, Random random) {
        this.cache = cache;
        this.metrics = metrics;
        this.clock = clock;
        this.location = location;
        this.baseline = baseline;
        this.jitter = jitter.abs();
        this.random = random;
    }

    public String location() {
        return location;
    }

    /**
     * What pricing uses. Never waits on the network: a missing or stale value schedules a
     * background refresh and the best value held right now is returned.
     */
    public MarketReading current() {
        MarketDataEntry<BigDecimal> entry = cache.peek().orElse(null);
        if (entry == null) {
            cache.refreshAsync();
            entry = cache.seedIfAbsent(estimate(), ReadingStatus.ESTIMATE.tag());
        } else {
            entry = cache.get().orElse(entry);
        }
        return served(entry);
    }

    /**
     * What the gold price endpoint uses. Waits for the first fetch when nothing is cached yet.
     */
    public MarketReading lookup() {
        MarketDataEntry<BigDecimal> entry = cache.get()
                .orElseGet(() -> cache.seedIfAbsent(estimate(), ReadingStatus.ESTIMATE.tag()));
        return served(entry);
    }

    /**
     * Forces a fetch. On failure the previous value (or an estimate) is returned instead.
     */
    public MarketReading refresh() {
        RefreshResult<BigDecimal> result = cache.refresh();
        if (result.isSuccess()) {
            return served(result.entry());
        }
        metrics.incUpstreamError(Market.GOLD.metricTag());
        log.warn("Gold price refresh failed ({}), serving fallback", result.error());
        MarketDataEntry<BigDecimal> fallback = result.entry() != null
                ? result.entry()
                : cache.seedIfAbsent(estimate(), ReadingStatus.ESTIMATE.tag());
        return served(fallback);
    }

    BigDecimal estimate() {
        BigDecimal offset = jitter.multiply(BigDecimal.valueOf(random.nextDouble() * 2 - 1));
        return baseline.add(offset).setScale(0, RoundingMode.HALF_UP);
    }

    private MarketReading served(MarketDataEntry<BigDecimal> entry) {
        MarketReading reading = MarketReading.of(entry, clock.instant(), cache.ttl());
        metrics.incServed(Market.GOLD.metricTag(), reading.status().tag());
        if (reading.status().isFallback()) {
            log.debug("Serving {} gold price {} (source={})", reading.status().tag(), reading.value(), reading.source());
        }
        return reading;
    }
}
