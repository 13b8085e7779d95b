package com.example.jewelry_pricing.ops;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.example.jewelry_pricing.market.MarketDataCache;
import com.example.jewelry_pricing.market.MutableClock;
import com.example.jewelry_pricing.market.SourcedValue;

class HealthControllerTest {

    @Test
    void health_reportsMarketDataAges() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
        MarketDataCache<BigDecimal> gold = new MarketDataCache<>("gold", Duration.ofHours(1), Duration.ZERO,
                () -> new SourcedValue<>(new BigDecimal("9800"), "market-page:json"), clock, Runnable::run);
        MarketDataCache<BigDecimal> fx = new MarketDataCache<>("fx", Duration.ofHours(1), Duration.ZERO,
                () -> new SourcedValue<>(new BigDecimal("83"), "exchangerate-api"), clock, Runnable::run);
        gold.refresh();
        clock.advance(Duration.ofMinutes(90));

        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new HealthController(gold, fx, clock)).build();

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.goldPrice.state").value("STALE"))
                .andExpect(jsonPath("$.goldPrice.ageSeconds").value(5400))
                .andExpect(jsonPath("$.goldPrice.source").value("market-page:json"))
                .andExpect(jsonPath("$.exchangeRate.state").value("EMPTY"));
    }
}
