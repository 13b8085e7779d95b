package com.example.jewelry_pricing.dto;

import java.util.Map;

import com.example.jewelry_pricing.pricing.CurrencyQuote;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * Client-side view of the calculate-price response body.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalculatePriceResponse {
    private boolean success;
    private CurrencyQuote usd;
    private CurrencyQuote inr;
    private Map<String, Object> inputs;
    private String error;
    private String message;
}
