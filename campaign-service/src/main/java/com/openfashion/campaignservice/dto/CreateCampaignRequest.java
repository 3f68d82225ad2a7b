package com.openfashion.campaignservice.dto;

import com.openfashion.campaignservice.core.validation.ValidCampaignRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

@ValidCampaignRequest
public record CreateCampaignRequest(
        @NotNull @Positive BigDecimal goal,
        @NotNull @Positive BigDecimal minContribution,
        @NotNull @Positive BigDecimal maxContribution,
        @Positive int durationDays,
        @NotBlank @Size(max = 200) String title,
        @Size(max = 4000) String description,
        @Size(max = 500) String mediaReference,
        @Size(max = 50) String category,
        String tokenId, // null funds the campaign in native currency
        @Valid WithdrawalSettingsRequest withdrawals
) {
}
