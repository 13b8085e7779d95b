package com.example.jewelry_pricing.market;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MarketDataMetrics {

    private final MeterRegistry registry;

    public MarketDataMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incServed(String market, String source) {
        Counter.builder("jewelry_market_data_served_total")
                .tag("market", market)
                .tag("source", source) // live | stale-cache | estimate | default
                .register(registry)
                .increment();
    }

    public void incUpstreamError(String market) {
        Counter.builder("jewelry_market_data_upstream_errors_total")
                .tag("market", market)
                .register(registry)
                .increment();
    }

    public void incAnomaly(String market) {
        Counter.builder("jewelry_market_data_anomalies_total")
                .tag("market", market)
                .register(registry)
                .increment();
    }
}
