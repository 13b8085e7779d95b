package com.example.jewelry_pricing.client;

import java.util.concurrent.CompletableFuture;

import com.example.jewelry_pricing.dto.CalculatePriceRequest;
import com.example.jewelry_pricing.pricing.PriceQuote;

/**
 * Transport for calculate-price requests.
 */
public interface PriceCalculationClient {

    CompletableFuture<PriceQuote> calculate(CalculatePriceRequest request);
}
