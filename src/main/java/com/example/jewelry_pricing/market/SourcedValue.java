package com.example.jewelry_pricing.market;

/**
 * What a fetcher hands back: the value and a tag naming where it came from.
 */
public record SourcedValue<T>(T value, String source) {
}
