package com.example.jewelry_pricing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class HttpClientsConfig {

    /**
     * Shared client for market pages and APIs. Market pages are full HTML documents, so the
     * default 256KB buffer is raised.
     */
    @Bean
    public WebClient marketDataWebClient(
            WebClient.Builder builder,
            @Value("${market-data.max-response-bytes:2097152}") int maxResponseBytes) {
        return builder
                .defaultHeader("User-Agent", "Mozilla/5.0 (compatible; JewelryPricing/1.0)")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxResponseBytes))
                .build();
    }

    /**
     * Client used by {@code WebClientPriceCalculationClient} to reach the pricing endpoint.
     */
    @Bean
    public WebClient pricingApiWebClient(
            WebClient.Builder builder,
            @Value("${pricing.client.base-url:http://localhost:8080}") String baseUrl) {
        return builder.baseUrl(baseUrl).build();
    }
}
