package com.example.jewelry_pricing.gold;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import com.example.jewelry_pricing.market.MarketDataException;
import com.example.jewelry_pricing.market.MarketDataFetcher;
import com.example.jewelry_pricing.market.SourcedValue;

/**
 * Downloads the market page and runs the extractor chain over it. The first extractor that yields
 * a value inside the price band wins; if none does, the fetch fails.
 */
public class GoldPriceSource implements MarketDataFetcher<BigDecimal> {

    private static final Logger log = LoggerFactory.getLogger(GoldPriceSource.class);

    private final WebClient webClient;
    private final String sourceUrl;
    private final Duration timeout;
    private final List<GoldPriceExtractor> extractors;
    private final PriceBand band;

    public GoldPriceSource(WebClient webClient, String sourceUrl, Duration timeout,
            List<GoldPriceExtractor> extractors, PriceBand band) {
        this.webClient = webClient;
        this.sourceUrl = sourceUrl;
        this.timeout = timeout;
        this.extractors = List.copyOf(extractors);
        this.band = band;
    }

    @Override
    public SourcedValue<BigDecimal> fetch() {
        String body;
        try {
            body = webClient.get()
                    .uri(sourceUrl)
                    .header(HttpHeaders.ACCEPT, "text/html,application/json;q=0.9,*/*;q=0.8")
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception e) {
            throw new MarketDataException("Gold price request failed: " + e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new MarketDataException("Empty response from gold price source");
        }
        return parse(body);
    }

    /**
     * Runs the extractor chain over an already downloaded body.
     */
    public SourcedValue<BigDecimal> parse(String body) {
        for (GoldPriceExtractor extractor : extractors) {
            Optional<BigDecimal> value = extractor.extract(body, band);
            if (value.isPresent()) {
                log.debug("Gold price extracted by {}: {}", extractor.name(), value.get());
                return new SourcedValue<>(value.get().setScale(2, RoundingMode.HALF_UP),
                        "market-page:" + extractor.name());
            }
            log.debug("Gold price extractor {} found nothing within {}..{}", extractor.name(), band.min(), band.max());
        }
        throw new MarketDataException("No gold price within " + band.min() + ".." + band.max() + " INR/g found in response");
    }
}
