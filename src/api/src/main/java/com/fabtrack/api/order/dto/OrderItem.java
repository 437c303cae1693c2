package com.fabtrack.api.order.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record OrderItem(
    @NotBlank(message = "Each item must have a description") String description,
    @NotNull(message = "Each item must have a quantity")
    @Positive(message = "Each item must have a quantity") BigDecimal quantity,
    String unit,
    String remarks
) {
}
