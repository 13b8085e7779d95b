package com.example.jewelry_pricing.market;

import java.time.Duration;
import java.time.Instant;

/**
 * A market value together with when and where it was obtained.
 *
 * <p>{@code provisional} entries are placeholders (estimates, configured defaults) seeded while no
 * live value has ever been fetched. They are always considered stale so the next read schedules a
 * refresh.
 */
public record MarketDataEntry<T>(T value, Instant fetchedAt, String source, boolean provisional) {

    public static <T> MarketDataEntry<T> live(T value, Instant fetchedAt, String source) {
        return new MarketDataEntry<>(value, fetchedAt, source, false);
    }

    public static <T> MarketDataEntry<T> provisional(T value, Instant fetchedAt, String source) {
        return new MarketDataEntry<>(value, fetchedAt, source, true);
    }

    public boolean isStale(Instant now, Duration ttl) {
        if (provisional) {
            return true;
        }
        return Duration.between(fetchedAt, now).compareTo(ttl) > 0;
    }

    public Duration age(Instant now) {
        return Duration.between(fetchedAt, now);
    }

    public MarketDataEntry<T> withSource(String newSource) {
        return new MarketDataEntry<>(value, fetchedAt, newSource, provisional);
    }
}
