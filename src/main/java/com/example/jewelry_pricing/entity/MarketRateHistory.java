package com.example.jewelry_pricing.entity;

import java.math.BigDecimal;
import java.time.Instant;

import com.example.jewelry_pricing.market.Market;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Data;

/**
 * One successfully fetched market value (gold price or exchange rate).
 */
@Data
@Entity
@Table(name = "market_rate_history")
public class MarketRateHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Market market;

    @Column(name = "rate_value", nullable = false, precision = 18, scale = 6)
    private BigDecimal value;

    @Column(nullable = false)
    private Instant fetchedAt;

    @Column(length = 80)
    private String source;

    /**
     * Change against the previous row in percent. Null for the first row of a market.
     */
    @Column(precision = 10, scale = 4)
    private BigDecimal changePercent;

    @Column(nullable = false)
    private boolean anomaly = false;

    @PrePersist
    protected void onCreate() {
        if (fetchedAt == null) {
            fetchedAt = Instant.now();
        }
    }
}
