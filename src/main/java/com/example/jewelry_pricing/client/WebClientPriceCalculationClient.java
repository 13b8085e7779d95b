package com.example.jewelry_pricing.client;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.example.jewelry_pricing.dto.CalculatePriceRequest;
import com.example.jewelry_pricing.dto.CalculatePriceResponse;
import com.example.jewelry_pricing.pricing.PriceQuote;

import reactor.core.publisher.Mono;

/**
 * Calls {@code POST /api/calculate-price} over HTTP.
 */
@Component
public class WebClientPriceCalculationClient implements PriceCalculationClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientPriceCalculationClient(
            @Qualifier("pricingApiWebClient") WebClient webClient,
            @Value("${pricing.client.timeout-ms:10000}") long timeoutMs) {
        this.webClient = webClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    @Override
    public CompletableFuture<PriceQuote> calculate(CalculatePriceRequest request) {
        return webClient.post()
                .uri("/api/calculate-price")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(CalculatePriceResponse.class)
                .timeout(timeout)
                .flatMap(this::toQuote)
                .onErrorMap(WebClientResponseException.class, e -> new PriceRequestFailedException(
                        "calculate-price returned " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(), e))
                .toFuture();
    }

    private Mono<PriceQuote> toQuote(CalculatePriceResponse res) {
        if (!res.isSuccess() || res.getInr() == null || res.getUsd() == null) {
            String reason = res.getMessage() != null ? res.getMessage() : res.getError();
            return Mono.error(new PriceRequestFailedException(
                    "calculate-price failed: " + (reason != null ? reason : "no quote in response")));
        }
        return Mono.just(new PriceQuote(res.getInr(), res.getUsd()));
    }
}
