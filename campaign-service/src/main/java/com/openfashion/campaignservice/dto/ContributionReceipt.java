package com.openfashion.campaignservice.dto;

import com.openfashion.campaignservice.model.CampaignStatus;

import java.math.BigDecimal;
import java.util.UUID;

public record ContributionReceipt(
        Long campaignId,
        UUID contributorId,
        BigDecimal amount,
        BigDecimal totalContributed,
        BigDecimal amountRaised,
        CampaignStatus status
) {
}
