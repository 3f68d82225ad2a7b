package com.openfashion.campaignservice.dto;

import java.math.BigDecimal;

public record RefundSweepResult(
        Long campaignId,
        int refundedContributors,
        BigDecimal refundedAmount,
        boolean finished
) {
}
