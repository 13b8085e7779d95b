package com.example.jewelry_pricing.market;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds a single market value (gold price, exchange rate) with a TTL and a last-good fallback.
 *
 * <ul>
 * <li>{@link #get()} never waits on the network while an entry exists; a stale entry is returned
 * as-is and a background refresh is scheduled.</li>
 * <li>{@link #refresh()} replaces the entry only on success. A failed fetch leaves the stored
 * entry untouched and is reported through {@link RefreshResult}, never thrown.</li>
 * <li>Concurrent refreshes share one in-flight fetch.</li>
 * </ul>
 */
public class MarketDataCache<T> {

    private static final Logger log = LoggerFactory.getLogger(MarketDataCache.class);

    private final String name;
    private final Duration ttl;
    private final Duration retryBackoff;
    private final MarketDataFetcher<T> fetcher;
    private final Clock clock;
    private final Executor executor;

    private final Object writeLock = new Object();
    private final AtomicReference<CompletableFuture<RefreshResult<T>>> inFlight = new AtomicReference<>();
    private final List<Consumer<MarketDataEntry<T>>> listeners = new CopyOnWriteArrayList<>();

    private volatile MarketDataEntry<T> entry;
    private volatile Instant lastFailureAt;

    public MarketDataCache(String name, Duration ttl, Duration retryBackoff,
            MarketDataFetcher<T> fetcher, Clock clock, Executor executor) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.name = name;
        this.ttl = ttl;
        this.retryBackoff = retryBackoff == null ? Duration.ZERO : retryBackoff;
        this.fetcher = fetcher;
        this.clock = clock;
        this.executor = executor;
    }

    public String name() {
        return name;
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Current entry without any side effect.
     */
    public Optional<MarketDataEntry<T>> peek() {
        return Optional.ofNullable(entry);
    }

    /**
     * Freshest known entry. Blocks only when the cache has never held a value, in which case all
     * concurrent callers wait on the same fetch.
     */
    public Optional<MarketDataEntry<T>> get() {
        MarketDataEntry<T> current = entry;
        Instant now = clock.instant();

        if (current == null) {
            if (!retryAllowed(now)) {
                return Optional.empty();
            }
            return Optional.ofNullable(refresh().entry());
        }

        if (current.isStale(now, ttl) && retryAllowed(now)) {
            refreshAsync();
        }
        return Optional.of(current);
    }

    public boolean isStale() {
        MarketDataEntry<T> current = entry;
        return current == null || current.isStale(clock.instant(), ttl);
    }

    /**
     * Fetches now (or joins the fetch already running) and waits for the outcome.
     */
    public RefreshResult<T> refresh() {
        return refreshAsync().join();
    }

    public CompletableFuture<RefreshResult<T>> refreshAsync() {
        while (true) {
            CompletableFuture<RefreshResult<T>> running = inFlight.get();
            if (running != null) {
                return running;
            }
            CompletableFuture<RefreshResult<T>> created = new CompletableFuture<>();
            if (inFlight.compareAndSet(null, created)) {
                try {
                    executor.execute(() -> runFetch(created));
                } catch (RejectedExecutionException e) {
                    // never fetch on the caller's thread; callers fall back to what is cached
                    log.warn("[{}] refresh executor rejected task, skipping refresh", name);
                    lastFailureAt = clock.instant();
                    inFlight.compareAndSet(created, null);
                    created.complete(RefreshResult.failure(entry, "refresh executor rejected task"));
                }
                return created;
            }
        }
    }

    /**
     * Stores a placeholder value if nothing has been cached yet. Returns the entry now held.
     */
    public MarketDataEntry<T> seedIfAbsent(T value, String source) {
        synchronized (writeLock) {
            if (entry == null) {
                entry = MarketDataEntry.provisional(value, clock.instant(), source);
                log.warn("[{}] seeded provisional value {} (source={})", name, value, source);
            }
            return entry;
        }
    }

    public void addListener(Consumer<MarketDataEntry<T>> listener) {
        listeners.add(listener);
    }

    private boolean retryAllowed(Instant now) {
        Instant failedAt = lastFailureAt;
        return failedAt == null || !now.isBefore(failedAt.plus(retryBackoff));
    }

    private void runFetch(CompletableFuture<RefreshResult<T>> target) {
        RefreshResult<T> result;
        MarketDataEntry<T> fresh = null;
        try {
            SourcedValue<T> fetched = fetcher.fetch();
            if (fetched == null || fetched.value() == null) {
                throw new MarketDataException("fetcher returned no value");
            }
            fresh = MarketDataEntry.live(fetched.value(), clock.instant(), fetched.source());
            synchronized (writeLock) {
                entry = fresh;
                lastFailureAt = null;
            }
            log.info("[{}] refreshed value={} source={}", name, fresh.value(), fresh.source());
            result = RefreshResult.success(fresh);
        } catch (Exception e) {
            lastFailureAt = clock.instant();
            log.warn("[{}] refresh failed, keeping previous entry: {}", name, e.getMessage());
            result = RefreshResult.failure(entry, e.getMessage());
        } finally {
            inFlight.compareAndSet(target, null);
        }

        target.complete(result);

        if (fresh != null) {
            notifyListeners(fresh);
        }
    }

    private void notifyListeners(MarketDataEntry<T> fresh) {
        for (Consumer<MarketDataEntry<T>> listener : listeners) {
            try {
                listener.accept(fresh);
            } catch (RuntimeException e) {
                log.error("[{}] refresh listener failed", name, e);
            }
        }
    }
}
