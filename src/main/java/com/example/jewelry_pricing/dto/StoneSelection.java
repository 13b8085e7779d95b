package com.example.jewelry_pricing.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoneSelection {

    private String stoneTypeId; // numeric id, name, or "none_selected"

    @DecimalMin(value = "0", message = "caratWeight must not be negative")
    private BigDecimal caratWeight;
}
