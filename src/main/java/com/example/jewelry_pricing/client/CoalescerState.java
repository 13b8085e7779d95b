package com.example.jewelry_pricing.client;

public enum CoalescerState {
    IDLE,
    DEBOUNCING,
    IN_FLIGHT,
    DONE
}
