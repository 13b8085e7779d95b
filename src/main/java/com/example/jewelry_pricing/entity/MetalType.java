package com.example.jewelry_pricing.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Admin-managed metal catalog row. Read-only to the pricing engine.
 */
@Entity
@Table(name = "metal_types")
@Getter
@Setter
@NoArgsConstructor
public class MetalType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(length = 1000)
    private String description;

    /**
     * Combined purity x multiplier in percent (75 = 18K). Used when the explicit factors below
     * are not set.
     */
    @Column(name = "price_modifier", precision = 8, scale = 3)
    private BigDecimal priceModifierPercent;

    /** Fraction of pure gold, (0, 1]. */
    @Column(name = "purity_factor", precision = 6, scale = 4)
    private BigDecimal purityFactor;

    /** Markup for alloy colour or metal family, >= 1. */
    @Column(name = "type_multiplier", precision = 6, scale = 4)
    private BigDecimal typeMultiplier;

    @Column(name = "display_order", nullable = false)
    private Integer displayOrder;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(length = 20)
    private String color;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public MetalType(String name) {
        this.name = name;
    }

    @PrePersist
    void prePersist() {
        if (displayOrder == null)
            displayOrder = 0;
        if (createdAt == null)
            createdAt = LocalDateTime.now();
    }
}
