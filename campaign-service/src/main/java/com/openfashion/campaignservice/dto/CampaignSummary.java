package com.openfashion.campaignservice.dto;

import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignStatus;
import com.openfashion.campaignservice.model.WithdrawalPolicy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

public record CampaignSummary(
        Long id,
        UUID creatorId,
        String title,
        String description,
        String mediaReference,
        String category,
        BigDecimal goal,
        BigDecimal amountRaised,
        BigDecimal amountReleased,
        BigDecimal minContribution,
        BigDecimal maxContribution,
        Instant deadline,
        String fundingAsset,
        CampaignStatus status,
        boolean completed,
        boolean refundable,
        boolean verified,
        boolean promoted,
        int backerCount,
        boolean partialWithdrawalsEnabled,
        boolean withdrawalLimitEnabled,
        BigDecimal withdrawalCeiling,
        BigDecimal totalWithdrawn,
        Instant lastWithdrawalAt,
        long minWithdrawalIntervalSeconds,
        List<MilestoneView> milestones
) {
    public static CampaignSummary from(Campaign campaign) {
        WithdrawalPolicy policy = campaign.getWithdrawalPolicy();
        List<MilestoneView> milestones = IntStream.range(0, campaign.getMilestones().size())
                .mapToObj(i -> MilestoneView.from(i, campaign.getMilestones().get(i)))
                .toList();

        return new CampaignSummary(
                campaign.getId(),
                campaign.getCreatorId(),
                campaign.getTitle(),
                campaign.getDescription(),
                campaign.getMediaReference(),
                campaign.getCategory(),
                campaign.getGoal(),
                campaign.getAmountRaised(),
                campaign.getAmountReleased(),
                campaign.getMinContribution(),
                campaign.getMaxContribution(),
                campaign.getDeadline(),
                campaign.getFundingAsset().toString(),
                campaign.getStatus(),
                campaign.isCompleted(),
                campaign.isRefundable(),
                campaign.isVerified(),
                campaign.isPromoted(),
                campaign.getBackerCount(),
                policy.isPartialWithdrawalsEnabled(),
                policy.isLimitEnabled(),
                policy.getCeiling(),
                policy.getTotalWithdrawn(),
                policy.getLastWithdrawalAt(),
                policy.getMinIntervalSeconds(),
                milestones
        );
    }
}
