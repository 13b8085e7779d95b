package com.example.jewelry_pricing.market;

/**
 * Performs one round trip to an external market-data source.
 *
 * <p>Implementations throw on any failure (timeout, HTTP error, unparseable or implausible
 * value); the cache decides what to keep.
 */
@FunctionalInterface
public interface MarketDataFetcher<T> {

    SourcedValue<T> fetch() throws Exception;
}
