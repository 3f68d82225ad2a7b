package com.openfashion.campaignservice.dto;

import com.openfashion.campaignservice.service.FeeSplit;

import java.math.BigDecimal;

public record PayoutResult(
        Long campaignId,
        BigDecimal gross,
        BigDecimal fee,
        BigDecimal net
) {
    public static PayoutResult of(Long campaignId, FeeSplit split) {
        return new PayoutResult(campaignId, split.gross(), split.fee(), split.net());
    }
}
