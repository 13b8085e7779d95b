package com.example.jewelry_pricing.fx;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;

import org.springframework.web.reactive.function.client.WebClient;

import com.example.jewelry_pricing.market.MarketDataException;
import com.example.jewelry_pricing.market.MarketDataFetcher;
import com.example.jewelry_pricing.market.SourcedValue;

/**
 * USD to INR from ExchangeRate-API. With an API key the pair endpoint is used, otherwise the
 * open "latest USD" endpoint.
 */
public class ExchangeRateSource implements MarketDataFetcher<BigDecimal> {

    static final String SOURCE = "exchangerate-api";

    private final WebClient webClient;
    private final String openUrl;
    private final String apiKey;
    private final Duration timeout;
    private final BigDecimal minRate;
    private final BigDecimal maxRate;

    public ExchangeRateSource(WebClient webClient, String openUrl, String apiKey, Duration timeout,
            BigDecimal minRate, BigDecimal maxRate) {
        this.webClient = webClient;
        this.openUrl = openUrl;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.minRate = minRate;
        this.maxRate = maxRate;
    }

    @Override
    public SourcedValue<BigDecimal> fetch() {
        String url = (apiKey == null || apiKey.isBlank())
                ? openUrl
                : String.format("https://v6.exchangerate-api.com/v6/%s/pair/USD/INR", apiKey);

        Map<String, Object> response;
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(Map.class)
                    .timeout(timeout)
                    .block();
            response = body;
        } catch (Exception e) {
            throw new MarketDataException("FX API call failed: " + e.getMessage(), e);
        }

        return new SourcedValue<>(parse(response), SOURCE);
    }

    /**
     * Reads either {@code conversion_rate} (pair endpoint) or {@code rates.INR} (latest endpoint).
     */
    public BigDecimal parse(Map<String, Object> response) {
        if (response == null) {
            throw new MarketDataException("Empty response from FX API");
        }

        Object result = response.get("result");
        if (result != null && !"success".equals(result)) {
            throw new MarketDataException("FX API error: " + response.get("error-type"));
        }

        Object rateObj = response.get("conversion_rate");
        if (rateObj == null && response.get("rates") instanceof Map<?, ?> rates) {
            rateObj = rates.get("INR");
        }
        if (rateObj == null) {
            throw new MarketDataException("No USD/INR rate in FX API response");
        }

        BigDecimal rate;
        try {
            // via String to keep the API's precision
            rate = new BigDecimal(String.valueOf(rateObj)).setScale(4, RoundingMode.HALF_UP);
        } catch (NumberFormatException e) {
            throw new MarketDataException("Invalid rate format: " + rateObj, e);
        }

        if (rate.compareTo(minRate) < 0 || rate.compareTo(maxRate) > 0) {
            throw new MarketDataException("USD/INR rate " + rate + " outside " + minRate + ".." + maxRate);
        }
        return rate;
    }
}
