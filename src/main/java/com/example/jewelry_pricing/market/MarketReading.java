package com.example.jewelry_pricing.market;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * A market value as served to consumers: the cached entry plus how trustworthy it currently is.
 */
public record MarketReading(BigDecimal value, Instant timestamp, String source, ReadingStatus status) {

    public static MarketReading of(MarketDataEntry<BigDecimal> entry, Instant now, Duration ttl) {
        ReadingStatus status;
        if (entry.provisional()) {
            status = ReadingStatus.DEFAULT.tag().equals(entry.source()) ? ReadingStatus.DEFAULT : ReadingStatus.ESTIMATE;
        } else if (entry.isStale(now, ttl)) {
            status = ReadingStatus.STALE;
        } else {
            status = ReadingStatus.LIVE;
        }
        return new MarketReading(entry.value(), entry.fetchedAt(), entry.source(), status);
    }
}
