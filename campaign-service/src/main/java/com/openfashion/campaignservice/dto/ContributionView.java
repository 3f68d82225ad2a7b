package com.openfashion.campaignservice.dto;

import com.openfashion.campaignservice.model.Contribution;

import java.math.BigDecimal;
import java.util.UUID;

public record ContributionView(
        UUID contributorId,
        BigDecimal amount,
        int rosterPosition
) {
    public static ContributionView from(Contribution contribution) {
        return new ContributionView(contribution.getContributorId(), contribution.getAmount(), contribution.getRosterPosition());
    }
}
