package com.openfashion.campaignservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

public record FeeRateRequest(
        @Min(0) @Max(10_000) int basisPoints
) {
}
