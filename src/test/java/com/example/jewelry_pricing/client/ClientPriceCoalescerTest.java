package com.example.jewelry_pricing.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.jewelry_pricing.dto.CalculatePriceRequest;
import com.example.jewelry_pricing.dto.StoneSelection;
import com.example.jewelry_pricing.pricing.CurrencyQuote;
import com.example.jewelry_pricing.pricing.PriceBreakdown;
import com.example.jewelry_pricing.pricing.PriceQuote;

class ClientPriceCoalescerTest {

    private static final Duration DEBOUNCE = Duration.ofMillis(100);

    /**
     * Records every request and hands back a future the test completes.
     */
    static class RecordingClient implements PriceCalculationClient {
        final List<CalculatePriceRequest> requests = new CopyOnWriteArrayList<>();
        final List<CompletableFuture<PriceQuote>> pending = new CopyOnWriteArrayList<>();

        @Override
        public CompletableFuture<PriceQuote> calculate(CalculatePriceRequest request) {
            requests.add(request);
            CompletableFuture<PriceQuote> f = new CompletableFuture<>();
            pending.add(f);
            return f;
        }

        void awaitRequests(int n) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 3000;
            while (requests.size() < n && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(requests).hasSizeGreaterThanOrEqualTo(n);
        }
    }

    private ScheduledExecutorService scheduler;
    private RecordingClient client;
    private PriceUpdateListener listener;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        client = new RecordingClient();
        listener = mock(PriceUpdateListener.class);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private ClientPriceCoalescer coalescer(CoalescerMode mode) {
        return new ClientPriceCoalescer(client, listener, mode, DEBOUNCE, scheduler);
    }

    private static CalculatePriceRequest ring(String grams) {
        CalculatePriceRequest req = new CalculatePriceRequest();
        req.setMetalTypeId("3");
        req.setMetalWeight(new BigDecimal(grams));
        req.setPrimaryStone(new StoneSelection("1", new BigDecimal("0.5")));
        return req;
    }

    private static PriceQuote quote(String inr) {
        BigDecimal p = new BigDecimal(inr);
        return new PriceQuote(new CurrencyQuote(p, "INR", PriceBreakdown.ZERO),
                new CurrencyQuote(p.divide(new BigDecimal("83"), 0, java.math.RoundingMode.HALF_UP), "USD",
                        PriceBreakdown.ZERO));
    }

    private static void quietPeriod() throws InterruptedException {
        Thread.sleep(DEBOUNCE.toMillis() * 3);
    }

    @Test
    void sameTupleTwiceWithinWindow_sendsOneRequest() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.AUTOMATIC);

        c.inputChanged(ring("10"));
        c.inputChanged(ring("10.00"));
        client.awaitRequests(1);
        client.pending.get(0).complete(quote("140313"));

        verify(listener, timeout(2000)).onPrice(any());
        quietPeriod();
        assertThat(client.requests).hasSize(1);
        assertThat(c.currentQuote()).isPresent();
        assertThat(c.state()).isEqualTo(CoalescerState.DONE);
    }

    @Test
    void burstOfEdits_sendsOnlyTheLast() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.AUTOMATIC);

        c.inputChanged(ring("1"));
        c.inputChanged(ring("2"));
        c.inputChanged(ring("3"));
        assertThat(c.state()).isEqualTo(CoalescerState.DEBOUNCING);

        client.awaitRequests(1);
        quietPeriod();
        assertThat(client.requests).hasSize(1);
        assertThat(client.requests.get(0).getMetalWeight()).isEqualByComparingTo("3");
    }

    @Test
    void timerAlreadyFiring_whenNewEditArrives_doesNotCutQuietPeriodShort() throws Exception {
        Duration debounce = Duration.ofMillis(300);
        ClientPriceCoalescer c = new ClientPriceCoalescer(client, listener, CoalescerMode.AUTOMATIC, debounce,
                scheduler);

        // hold the lock so the first timer fires and then waits on it
        synchronized (c) {
            c.inputChanged(ring("5"));
            Thread.sleep(450);
            c.inputChanged(ring("6"));
        }

        Thread.sleep(100);
        assertThat(client.requests).isEmpty();
        assertThat(c.state()).isEqualTo(CoalescerState.DEBOUNCING);

        client.awaitRequests(1);
        Thread.sleep(debounce.toMillis());
        assertThat(client.requests).hasSize(1);
        assertThat(client.requests.get(0).getMetalWeight()).isEqualByComparingTo("6");
    }

    @Test
    void tupleEqualToCompletedRequest_isNotResent() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.AUTOMATIC);
        c.inputChanged(ring("10"));
        client.awaitRequests(1);
        client.pending.get(0).complete(quote("1000"));
        verify(listener, timeout(2000)).onPrice(any());

        c.inputChanged(ring("10"));
        quietPeriod();

        assertThat(client.requests).hasSize(1);
        assertThat(c.state()).isEqualTo(CoalescerState.DONE);
    }

    @Test
    void changeWhileInFlight_isDeferredUntilResponse() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.AUTOMATIC);
        c.inputChanged(ring("10"));
        client.awaitRequests(1);
        assertThat(c.state()).isEqualTo(CoalescerState.IN_FLIGHT);

        c.inputChanged(ring("12"));
        quietPeriod();
        assertThat(client.requests).hasSize(1);
        assertThat(c.state()).isEqualTo(CoalescerState.IN_FLIGHT);

        PriceQuote first = quote("1000");
        client.pending.get(0).complete(first);
        client.awaitRequests(2);
        assertThat(client.requests.get(1).getMetalWeight()).isEqualByComparingTo("12");

        PriceQuote second = quote("1200");
        client.pending.get(1).complete(second);
        verify(listener, timeout(2000)).onPrice(second);
        assertThat(c.currentQuote()).contains(second);
        assertThat(c.requestsSent()).isEqualTo(2);
    }

    @Test
    void failedRequest_keepsPreviousQuote_andNotifies() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.AUTOMATIC);
        c.inputChanged(ring("10"));
        client.awaitRequests(1);
        PriceQuote good = quote("1000");
        client.pending.get(0).complete(good);
        verify(listener, timeout(2000)).onPrice(good);

        c.inputChanged(ring("11"));
        client.awaitRequests(2);
        RuntimeException failure = new PriceRequestFailedException("calculate-price returned 500");
        client.pending.get(1).completeExceptionally(failure);

        verify(listener, timeout(2000)).onError(any(), eq(good));
        assertThat(c.currentQuote()).contains(good);
        assertThat(c.state()).isEqualTo(CoalescerState.DONE);
    }

    @Test
    void failedTuple_canBeRetried() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.AUTOMATIC);
        c.inputChanged(ring("10"));
        client.awaitRequests(1);
        client.pending.get(0).completeExceptionally(new PriceRequestFailedException("timeout"));
        verify(listener, timeout(2000)).onError(any(), isNull());

        c.trigger();
        client.awaitRequests(2);
        assertThat(client.requests.get(1).getMetalWeight()).isEqualByComparingTo("10");
    }

    @Test
    void manualMode_sendsOnlyOnTrigger() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.MANUAL);

        c.inputChanged(ring("10"));
        c.inputChanged(ring("11"));
        quietPeriod();
        assertThat(client.requests).isEmpty();
        assertThat(c.state()).isEqualTo(CoalescerState.IDLE);

        c.trigger();
        assertThat(client.requests).hasSize(1);
        assertThat(client.requests.get(0).getMetalWeight()).isEqualByComparingTo("11");

        // same tuple again is still deduplicated
        c.trigger();
        assertThat(client.requests).hasSize(1);
    }

    @Test
    void nothingSentBeforeAnyInput() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.MANUAL);

        c.trigger();

        assertThat(client.requests).isEmpty();
        assertThat(c.state()).isEqualTo(CoalescerState.IDLE);
        verify(listener, never()).onPrice(any());
    }

    @Test
    void closedCoalescer_ignoresLateResponses() throws Exception {
        ClientPriceCoalescer c = coalescer(CoalescerMode.AUTOMATIC);
        c.inputChanged(ring("10"));
        client.awaitRequests(1);

        c.close();
        client.pending.get(0).complete(quote("1000"));
        quietPeriod();

        verify(listener, never()).onPrice(any());
        assertThat(c.currentQuote()).isEmpty();
    }

    @Test
    void parameters_ignoreTrailingZerosAndEmptyStoneSlots() {
        CalculatePriceRequest a = ring("10");
        CalculatePriceRequest b = ring("10.000");
        b.setOtherStone(new StoneSelection("none_selected", BigDecimal.ONE));
        b.setSecondaryStones(List.of(new StoneSelection("4", BigDecimal.ZERO)));

        assertThat(PriceParameters.of(a)).isEqualTo(PriceParameters.of(b));
        assertThat(PriceParameters.of(a)).isNotEqualTo(PriceParameters.of(ring("10.5")));
    }
}
