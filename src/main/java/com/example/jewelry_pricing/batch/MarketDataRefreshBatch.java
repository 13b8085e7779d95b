package com.example.jewelry_pricing.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.example.jewelry_pricing.fx.ExchangeRateProvider;
import com.example.jewelry_pricing.gold.GoldPriceProvider;
import com.example.jewelry_pricing.market.MarketReading;

/**
 * Keeps both market caches warm independent of request traffic.
 */
@Component
public class MarketDataRefreshBatch {

    private static final Logger log = LoggerFactory.getLogger(MarketDataRefreshBatch.class);

    private final GoldPriceProvider goldPriceProvider;
    private final ExchangeRateProvider exchangeRateProvider;

    public MarketDataRefreshBatch(GoldPriceProvider goldPriceProvider, ExchangeRateProvider exchangeRateProvider) {
        this.goldPriceProvider = goldPriceProvider;
        this.exchangeRateProvider = exchangeRateProvider;
    }

    @Scheduled(fixedDelayString = "${market-data.refresh-interval-ms:3600000}", initialDelay = 0)
    public void run() {
        MarketReading gold = refreshGold();
        MarketReading fx = refreshFx();
        log.info("[MarketDataRefreshBatch] gold={} ({}) fx={} ({})",
                gold == null ? "-" : gold.value(), gold == null ? "error" : gold.status().tag(),
                fx == null ? "-" : fx.value(), fx == null ? "error" : fx.status().tag());
    }

    private MarketReading refreshGold() {
        try {
            return goldPriceProvider.refresh();
        } catch (RuntimeException e) {
            log.error("[MarketDataRefreshBatch] gold refresh crashed", e);
            return null;
        }
    }

    private MarketReading refreshFx() {
        try {
            return exchangeRateProvider.refresh();
        } catch (RuntimeException e) {
            log.error("[MarketDataRefreshBatch] fx refresh crashed", e);
            return null;
        }
    }
}
