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
 * Admin-managed stone catalog row. Read-only to the pricing engine.
 */
@Entity
@Table(name = "stone_types")
@Getter
@Setter
@NoArgsConstructor
public class StoneType {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(length = 1000)
    private String description;

    /** INR per carat. */
    @Column(name = "price_per_carat", nullable = false, precision = 12, scale = 2)
    private BigDecimal pricePerCarat;

    @Column(length = 50)
    private String category; // natural, lab-grown, precious, semi-precious, pearl ...

    @Column(length = 50)
    private String quality;

    @Column(length = 50)
    private String size;

    @Column(name = "display_order", nullable = false)
    private Integer displayOrder;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(length = 20)
    private String color;

    @Column(name = "image_url")
    private String imageUrl;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    public StoneType(String name, BigDecimal pricePerCarat) {
        this.name = name;
        this.pricePerCarat = pricePerCarat;
    }

    @PrePersist
    void prePersist() {
        if (displayOrder == null)
            displayOrder = 0;
        if (createdAt == null)
            createdAt = LocalDateTime.now();
    }
}
