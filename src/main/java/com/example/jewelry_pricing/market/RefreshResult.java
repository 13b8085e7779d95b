package com.example.jewelry_pricing.market;

/**
 * Outcome of a refresh attempt. On failure {@code entry} is whatever the cache still holds
 * (possibly {@code null}) and {@code error} describes the failure.
 */
public record RefreshResult<T>(MarketDataEntry<T> entry, String error) {

    public static <T> RefreshResult<T> success(MarketDataEntry<T> entry) {
        return new RefreshResult<>(entry, null);
    }

    public static <T> RefreshResult<T> failure(MarketDataEntry<T> retained, String error) {
        return new RefreshResult<>(retained, error == null ? "unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null && entry != null;
    }
}
