package com.openfashion.campaignservice.dto;

import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

public record WithdrawalSettingsRequest(
        boolean partialWithdrawalsEnabled,
        boolean limitEnabled,
        @PositiveOrZero BigDecimal ceiling,
        @PositiveOrZero long minIntervalSeconds
) {
}
