package com.example.jewelry_pricing.market;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.reactive.function.client.WebClient;

import com.example.jewelry_pricing.fx.ExchangeRateSource;
import com.example.jewelry_pricing.gold.GoldPriceExtractors;
import com.example.jewelry_pricing.gold.GoldPriceSource;
import com.example.jewelry_pricing.gold.PriceBand;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * One cache per market, built once at startup and injected into its provider.
 */
@Configuration
public class MarketDataConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor marketDataExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("market-data-");
        executor.initialize();
        return executor;
    }

    @Bean
    public GoldPriceSource goldPriceSource(
            @Qualifier("marketDataWebClient") WebClient webClient,
            ObjectMapper objectMapper,
            @Value("${gold.source-url:https://www.goodreturns.in/gold-rates/hyderabad.html}") String sourceUrl,
            @Value("${market-data.fetch-timeout-ms:10000}") long timeoutMs,
            @Value("${gold.min-inr-per-gram:5000}") BigDecimal minPrice,
            @Value("${gold.max-inr-per-gram:10000}") BigDecimal maxPrice) {
        return new GoldPriceSource(webClient, sourceUrl, Duration.ofMillis(timeoutMs),
                GoldPriceExtractors.defaultChain(objectMapper), new PriceBand(minPrice, maxPrice));
    }

    @Bean
    public ExchangeRateSource exchangeRateSource(
            @Qualifier("marketDataWebClient") WebClient webClient,
            @Value("${fx.source-url:https://open.er-api.com/v6/latest/USD}") String sourceUrl,
            @Value("${fx.api-key:}") String apiKey,
            @Value("${market-data.fetch-timeout-ms:10000}") long timeoutMs,
            @Value("${fx.min-rate:50}") BigDecimal minRate,
            @Value("${fx.max-rate:100}") BigDecimal maxRate) {
        return new ExchangeRateSource(webClient, sourceUrl, apiKey, Duration.ofMillis(timeoutMs), minRate, maxRate);
    }

    @Bean
    public MarketDataCache<BigDecimal> goldPriceCache(
            GoldPriceSource source,
            MarketRateHistoryService history,
            Clock clock,
            ThreadPoolTaskExecutor marketDataExecutor,
            @Value("${market-data.ttl-ms:3600000}") long ttlMs,
            @Value("${market-data.retry-backoff-ms:60000}") long retryBackoffMs) {
        MarketDataCache<BigDecimal> cache = new MarketDataCache<>("gold", Duration.ofMillis(ttlMs),
                Duration.ofMillis(retryBackoffMs), source, clock, marketDataExecutor);
        cache.addListener(entry -> history.recordQuietly(Market.GOLD, entry));
        return cache;
    }

    @Bean
    public MarketDataCache<BigDecimal> exchangeRateCache(
            ExchangeRateSource source,
            MarketRateHistoryService history,
            Clock clock,
            ThreadPoolTaskExecutor marketDataExecutor,
            @Value("${market-data.ttl-ms:3600000}") long ttlMs,
            @Value("${market-data.retry-backoff-ms:60000}") long retryBackoffMs) {
        MarketDataCache<BigDecimal> cache = new MarketDataCache<>("fx", Duration.ofMillis(ttlMs),
                Duration.ofMillis(retryBackoffMs), source, clock, marketDataExecutor);
        cache.addListener(entry -> history.recordQuietly(Market.USD_INR, entry));
        return cache;
    }
}
