package com.example.jewelry_pricing.market;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.example.jewelry_pricing.entity.MarketRateHistory;
import com.example.jewelry_pricing.repo.MarketRateHistoryRepository;

/**
 * Appends every successful refresh to {@code market_rate_history} and flags sudden moves.
 */
@Service
public class MarketRateHistoryService {

    private static final Logger log = LoggerFactory.getLogger(MarketRateHistoryService.class);

    private final MarketRateHistoryRepository historyRepo;
    private final MarketDataMetrics metrics;
    private final BigDecimal anomalyThresholdPercent;

    public MarketRateHistoryService(
            MarketRateHistoryRepository historyRepo,
            MarketDataMetrics metrics,
            @Value("${market-data.anomaly-threshold-percent:5.0}") BigDecimal anomalyThresholdPercent) {
        this.historyRepo = historyRepo;
        this.metrics = metrics;
        this.anomalyThresholdPercent = anomalyThresholdPercent;
    }

    /**
     * @return true if the new value moved by at least the anomaly threshold
     */
    public boolean record(Market market, MarketDataEntry<BigDecimal> entry) {
        MarketRateHistory history = new MarketRateHistory();
        history.setMarket(market);
        history.setValue(entry.value());
        history.setFetchedAt(entry.fetchedAt());
        history.setSource(entry.source());

        boolean isAnomaly = false;
        var lastOpt = historyRepo.findTopByMarketOrderByFetchedAtDesc(market);
        if (lastOpt.isPresent() && lastOpt.get().getValue().signum() > 0) {
            BigDecimal lastValue = lastOpt.get().getValue();
            BigDecimal changePercent = entry.value().subtract(lastValue)
                    .divide(lastValue, 6, RoundingMode.HALF_UP)
                    .multiply(new BigDecimal("100"));
            history.setChangePercent(changePercent);

            if (changePercent.abs().compareTo(anomalyThresholdPercent) >= 0) {
                isAnomaly = true;
                history.setAnomaly(true);
                metrics.incAnomaly(market.metricTag());
                log.error("Market ANOMALY: {} moved {} -> {} ({}%), manual review needed",
                        market, lastValue, entry.value(), changePercent.setScale(2, RoundingMode.HALF_UP));
            }
        }

        historyRepo.save(history);
        return isAnomaly;
    }

    /**
     * Cache listener entry point. History is best effort and never disturbs the cached value.
     */
    public void recordQuietly(Market market, MarketDataEntry<BigDecimal> entry) {
        try {
            record(market, entry);
        } catch (RuntimeException e) {
            log.error("Failed to record {} history value={}", market, entry.value(), e);
        }
    }

    public List<MarketRateHistory> latest(Market market) {
        return historyRepo.findTop50ByMarketOrderByFetchedAtDesc(market);
    }

    public List<MarketRateHistory> anomalies() {
        return historyRepo.findTop100ByAnomalyTrueOrderByFetchedAtDesc();
    }
}
