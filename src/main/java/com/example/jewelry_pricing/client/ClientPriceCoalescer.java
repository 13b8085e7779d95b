package com.example.jewelry_pricing.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.jewelry_pricing.dto.CalculatePriceRequest;
import com.example.jewelry_pricing.pricing.PriceQuote;

/**
 * Turns a stream of input edits from one UI surface into as few calculate-price requests as
 * possible.
 *
 * <pre>
 * IDLE/DONE  --input-changed--&gt;     DEBOUNCING
 * DEBOUNCING --input-changed--&gt;     DEBOUNCING (timer restarted)
 * DEBOUNCING --debounce-elapsed--&gt;  IN_FLIGHT  (or back to IDLE/DONE if the tuple was already sent)
 * IN_FLIGHT  --response/error--&gt;    DONE       (then sends the deferred tuple, if any)
 * </pre>
 *
 * At most one request is outstanding. An edit that becomes due while a request is in flight is
 * deferred until that response arrives. Each request carries a sequence number and a response
 * whose number is not the latest one is dropped. A failed request keeps the previous quote.
 *
 * <p>All transitions run under the instance lock; listener callbacks run outside it on the
 * scheduler thread.
 */
public class ClientPriceCoalescer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientPriceCoalescer.class);

    public static final Duration DEFAULT_DEBOUNCE = Duration.ofMillis(500);

    private final PriceCalculationClient client;
    private final PriceUpdateListener listener;
    private final CoalescerMode mode;
    private final Duration debounce;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;

    private CoalescerState state = CoalescerState.IDLE;
    private PriceParameters latest;
    private PriceParameters lastRequested; // in flight or completed successfully
    private ScheduledFuture<?> debounceTask;
    private long debounceGeneration; // bumped whenever the pending timer is replaced or cancelled
    private long sequence;
    private long inFlightSequence = -1;
    private boolean deferred;
    private boolean closed;
    private volatile PriceQuote currentQuote;
    private long requestsSent;

    public ClientPriceCoalescer(PriceCalculationClient client, PriceUpdateListener listener, CoalescerMode mode) {
        this(client, listener, mode, DEFAULT_DEBOUNCE,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "price-coalescer");
                    t.setDaemon(true);
                    return t;
                }), true);
    }

    public ClientPriceCoalescer(PriceCalculationClient client, PriceUpdateListener listener, CoalescerMode mode,
            Duration debounce, ScheduledExecutorService scheduler) {
        this(client, listener, mode, debounce, scheduler, false);
    }

    private ClientPriceCoalescer(PriceCalculationClient client, PriceUpdateListener listener, CoalescerMode mode,
            Duration debounce, ScheduledExecutorService scheduler, boolean ownsScheduler) {
        this.client = Objects.requireNonNull(client, "client");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.debounce = debounce == null ? DEFAULT_DEBOUNCE : debounce;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Records the latest inputs. In automatic mode this (re)starts the debounce timer unless the
     * tuple equals the one already requested.
     */
    public synchronized void inputChanged(CalculatePriceRequest request) {
        if (closed) {
            return;
        }
        latest = PriceParameters.of(request);
        if (mode == CoalescerMode.MANUAL) {
            return;
        }

        cancelDebounce();
        if (latest.equals(lastRequested)) {
            // edits were undone back to what was already asked for
            deferred = false;
            settleState();
            return;
        }
        long generation = ++debounceGeneration;
        debounceTask = scheduler.schedule(() -> debounceElapsed(generation), debounce.toMillis(),
                TimeUnit.MILLISECONDS);
        if (state != CoalescerState.IN_FLIGHT) {
            state = CoalescerState.DEBOUNCING;
        }
    }

    /**
     * Sends the latest inputs now, skipping any pending debounce. Still a no-op when the tuple
     * was already requested.
     */
    public synchronized void trigger() {
        if (closed) {
            return;
        }
        cancelDebounce();
        send();
    }

    public Optional<PriceQuote> currentQuote() {
        return Optional.ofNullable(currentQuote);
    }

    public synchronized CoalescerState state() {
        return state;
    }

    public CoalescerMode mode() {
        return mode;
    }

    public synchronized long requestsSent() {
        return requestsSent;
    }

    @Override
    public synchronized void close() {
        closed = true;
        cancelDebounce();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    private synchronized void debounceElapsed(long generation) {
        // a superseded timer that was already running when it got cancelled
        if (closed || generation != debounceGeneration) {
            return;
        }
        debounceTask = null;
        send();
    }

    /** Caller holds the lock. */
    private void send() {
        PriceParameters params = latest;
        if (params == null || params.equals(lastRequested)) {
            settleState();
            return;
        }
        if (inFlightSequence >= 0) {
            deferred = true;
            state = CoalescerState.IN_FLIGHT;
            log.debug("Request in flight, deferring {}", params);
            return;
        }

        long seq = ++sequence;
        inFlightSequence = seq;
        lastRequested = params;
        deferred = false;
        state = CoalescerState.IN_FLIGHT;
        requestsSent++;
        log.debug("Sending price request #{} {}", seq, params);

        try {
            client.calculate(params.toRequest())
                    .whenCompleteAsync((quote, error) -> onResponse(seq, quote, error), scheduler);
        } catch (RuntimeException e) {
            // client failed before returning a future
            scheduler.execute(() -> onResponse(seq, null, e));
        }
    }

    private void onResponse(long seq, PriceQuote quote, Throwable error) {
        PriceQuote previous;
        synchronized (this) {
            if (closed) {
                return;
            }
            if (seq != inFlightSequence) {
                log.debug("Discarding stale response #{} (current #{})", seq, inFlightSequence);
                return;
            }
            inFlightSequence = -1;
            previous = currentQuote;
            if (error == null && quote != null) {
                currentQuote = quote;
            } else {
                // let the same tuple be retried
                lastRequested = null;
            }
            state = CoalescerState.DONE;
        }

        if (error == null && quote != null) {
            listener.onPrice(quote);
        } else {
            Throwable cause = error != null ? error : new PriceRequestFailedException("empty response");
            log.warn("Price request #{} failed, keeping previous price: {}", seq, cause.getMessage());
            listener.onError(cause, previous);
        }

        synchronized (this) {
            if (closed) {
                return;
            }
            if (deferred && debounceTask == null) {
                send();
            } else if (debounceTask != null) {
                state = CoalescerState.DEBOUNCING;
            }
        }
    }

    private void settleState() {
        if (inFlightSequence >= 0) {
            state = CoalescerState.IN_FLIGHT;
        } else if (debounceTask != null) {
            state = CoalescerState.DEBOUNCING;
        } else if (currentQuote != null || lastRequested != null) {
            state = CoalescerState.DONE;
        } else {
            state = CoalescerState.IDLE;
        }
    }

    private void cancelDebounce() {
        debounceGeneration++;
        if (debounceTask != null) {
            debounceTask.cancel(false);
            debounceTask = null;
        }
    }
}
