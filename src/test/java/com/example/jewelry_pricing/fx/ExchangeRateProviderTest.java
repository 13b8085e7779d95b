package com.example.jewelry_pricing.fx;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.jewelry_pricing.market.MarketDataCache;
import com.example.jewelry_pricing.market.MarketDataException;
import com.example.jewelry_pricing.market.MarketDataMetrics;
import com.example.jewelry_pricing.market.MarketReading;
import com.example.jewelry_pricing.market.MutableClock;
import com.example.jewelry_pricing.market.ReadingStatus;
import com.example.jewelry_pricing.market.SourcedValue;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class ExchangeRateProviderTest {

    private static final Duration TTL = Duration.ofHours(1);

    private MutableClock clock;
    private AtomicReference<Object> next;
    private ExchangeRateProvider provider;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
        next = new AtomicReference<>();
        MarketDataCache<BigDecimal> cache = new MarketDataCache<>("fx", TTL, Duration.ZERO, () -> {
            Object v = next.get();
            if (v instanceof RuntimeException e) {
                throw e;
            }
            return new SourcedValue<>((BigDecimal) v, "exchangerate-api");
        }, clock, Runnable::run);
        provider = new ExchangeRateProvider(cache, new MarketDataMetrics(new SimpleMeterRegistry()), clock,
                new BigDecimal("83"));
    }

    @Test
    void coldCacheAndFailingApi_servesDefaultRate() {
        next.set(new MarketDataException("FX API call failed: timeout"));

        MarketReading reading = provider.lookup();

        assertThat(reading.value()).isEqualByComparingTo("83");
        assertThat(reading.status()).isEqualTo(ReadingStatus.DEFAULT);
        assertThat(reading.source()).isEqualTo("default");
    }

    @Test
    void liveRate_replacesDefault() {
        next.set(new MarketDataException("down"));
        provider.current();

        next.set(new BigDecimal("83.4500"));
        MarketReading reading = provider.refresh();

        assertThat(reading.value()).isEqualByComparingTo("83.45");
        assertThat(reading.status()).isEqualTo(ReadingStatus.LIVE);
    }

    @Test
    void failureAfterSuccess_keepsLastGoodRate() {
        next.set(new BigDecimal("84.10"));
        provider.refresh();

        clock.advance(Duration.ofHours(2));
        next.set(new MarketDataException("down"));
        MarketReading reading = provider.refresh();

        assertThat(reading.value()).isEqualByComparingTo("84.10");
        assertThat(reading.status()).isEqualTo(ReadingStatus.STALE);
    }
}
