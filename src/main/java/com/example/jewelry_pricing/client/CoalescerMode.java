package com.example.jewelry_pricing.client;

public enum CoalescerMode {
    /** Sends after the debounce window whenever the inputs change. */
    AUTOMATIC,
    /** Sends only on {@link ClientPriceCoalescer#trigger()}. */
    MANUAL
}
