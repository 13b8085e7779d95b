package com.example.jewelry_pricing.market;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.example.jewelry_pricing.entity.MarketRateHistory;
import com.example.jewelry_pricing.exception.GlobalExceptionHandler;

class MarketHistoryControllerTest {

    private MockMvc mockMvc;
    private MarketRateHistoryService historyService;

    @BeforeEach
    void setUp() {
        historyService = mock(MarketRateHistoryService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new MarketHistoryController(historyService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void history_returnsRowsForMarket() throws Exception {
        MarketRateHistory row = new MarketRateHistory();
        row.setMarket(Market.USD_INR);
        row.setValue(new BigDecimal("83.5"));
        row.setFetchedAt(Instant.parse("2026-01-15T10:00:00Z"));
        row.setSource("exchangerate-api");
        when(historyService.latest(Market.USD_INR)).thenReturn(List.of(row));

        mockMvc.perform(get("/api/market-history/fx"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].market").value("USD_INR"))
                .andExpect(jsonPath("$[0].source").value("exchangerate-api"));
    }

    @Test
    void unknownMarket_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/market-history/silver"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_INPUT"));
    }
}
