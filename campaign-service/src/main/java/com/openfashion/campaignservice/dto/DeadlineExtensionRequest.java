package com.openfashion.campaignservice.dto;

import jakarta.validation.constraints.Positive;

public record DeadlineExtensionRequest(
        @Positive int additionalDays
) {
}
