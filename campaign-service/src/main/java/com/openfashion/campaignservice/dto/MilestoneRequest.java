package com.openfashion.campaignservice.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record MilestoneRequest(
        @NotNull @Positive BigDecimal amount,
        @NotBlank @Size(max = 500) String description
) {
}
