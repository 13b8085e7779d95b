package com.example.jewelry_pricing.client;

import com.example.jewelry_pricing.pricing.PriceQuote;

public interface PriceUpdateListener {

    void onPrice(PriceQuote quote);

    /**
     * The previous quote stays displayed; {@code previous} is null if there never was one.
     */
    void onError(Throwable error, PriceQuote previous);
}
