package com.example.jewelry_pricing.market;

public enum ReadingStatus {

    /** Fetched within the TTL. */
    LIVE("live"),

    /** Last good value, older than the TTL; a refresh is pending or has failed. */
    STALE("stale-cache"),

    /** Synthesized from a configured baseline because nothing was ever fetched. */
    ESTIMATE("estimate"),

    /** Configured default because nothing was ever fetched. */
    DEFAULT("default");

    private final String tag;

    ReadingStatus(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isFallback() {
        return this != LIVE;
    }
}
