package com.openfashion.campaignservice;

import com.openfashion.campaignservice.dto.CreateCampaignRequest;
import com.openfashion.campaignservice.dto.WithdrawalSettingsRequest;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.Contribution;
import com.openfashion.campaignservice.model.FundingAsset;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

final class CampaignFixtures {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private CampaignFixtures() {}

    static Campaign openCampaign(Long id, UUID creator, String goal) {
        return Campaign.builder()
                .id(id)
                .creatorId(creator)
                .title("Solar library roof")
                .goal(new BigDecimal(goal))
                .minContribution(new BigDecimal("1"))
                .maxContribution(new BigDecimal("10000"))
                .deadline(NOW.plus(Duration.ofDays(30)))
                .fundingAsset(FundingAsset.nativeCurrency())
                .build();
    }

    static Contribution contribution(Long campaignId, UUID contributor, String amount, int position) {
        return Contribution.builder()
                .campaignId(campaignId)
                .contributorId(contributor)
                .amount(new BigDecimal(amount))
                .rosterPosition(position)
                .build();
    }

    static CreateCampaignRequest createRequest(String goal, int durationDays, String tokenId) {
        return new CreateCampaignRequest(
                new BigDecimal(goal),
                new BigDecimal("1"),
                new BigDecimal("10000"),
                durationDays,
                "Solar library roof",
                "Panels for the community library",
                "ipfs://roof",
                "community",
                tokenId,
                null);
    }

    static CreateCampaignRequest createRequest(String goal, WithdrawalSettingsRequest withdrawals) {
        return new CreateCampaignRequest(
                new BigDecimal(goal),
                new BigDecimal("1"),
                new BigDecimal("10000"),
                30,
                "Solar library roof",
                null,
                null,
                null,
                null,
                withdrawals);
    }
}
