package com.openfashion.campaignservice.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record GoalUpdateRequest(
        @NotNull @Positive BigDecimal newGoal
) {
}
