package com.example.jewelry_pricing.gold;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.example.jewelry_pricing.market.MarketReading;
import com.example.jewelry_pricing.market.ReadingStatus;

class GoldPriceControllerTest {

    private static final Instant AT = Instant.parse("2026-01-15T10:00:00Z");

    private MockMvc mockMvc;
    private GoldPriceProvider provider;

    @BeforeEach
    void setUp() {
        provider = mock(GoldPriceProvider.class);
        when(provider.location()).thenReturn("Hyderabad, India");
        mockMvc = MockMvcBuilders.standaloneSetup(new GoldPriceController(provider)).build();
    }

    @Test
    void getGoldPrice_returnsPriceWithProvenance() throws Exception {
        when(provider.lookup()).thenReturn(
                new MarketReading(new BigDecimal("9835.00"), AT, "market-page:labelled-per-gram", ReadingStatus.LIVE));

        mockMvc.perform(get("/api/gold-price"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.price").value(9835.00))
                .andExpect(jsonPath("$.timestamp").value(AT.toEpochMilli()))
                .andExpect(jsonPath("$.location").value("Hyderabad, India"))
                .andExpect(jsonPath("$.status").value("live"));
    }

    @Test
    void estimate_isStillSuccess() throws Exception {
        when(provider.lookup()).thenReturn(
                new MarketReading(new BigDecimal("9781"), AT, "estimate", ReadingStatus.ESTIMATE));

        mockMvc.perform(get("/api/gold-price"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.source").value("estimate"));
    }

    @Test
    void internalError_reportsFailure() throws Exception {
        when(provider.lookup()).thenThrow(new IllegalStateException("cache not configured"));

        mockMvc.perform(get("/api/gold-price"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("cache not configured"));
    }

    @Test
    void refresh_reportsWhetherLiveValueWasObtained() throws Exception {
        when(provider.refresh()).thenReturn(
                new MarketReading(new BigDecimal("9750"), AT, "market-page:json", ReadingStatus.STALE));

        mockMvc.perform(post("/api/gold-price/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refreshed").value(false))
                .andExpect(jsonPath("$.status").value("stale-cache"));
    }
}
