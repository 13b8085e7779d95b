package com.example.jewelry_pricing.dto;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CalculatePriceRequest {

    @NotBlank(message = "metalTypeId is required")
    private String metalTypeId;

    @NotNull(message = "metalWeight is required")
    @DecimalMin(value = "0", message = "metalWeight must not be negative")
    private BigDecimal metalWeight; // grams

    @Valid
    private StoneSelection primaryStone;

    @Valid
    @Size(max = 10)
    private List<StoneSelection> secondaryStones = new ArrayList<>();

    @Valid
    private StoneSelection otherStone;
}
