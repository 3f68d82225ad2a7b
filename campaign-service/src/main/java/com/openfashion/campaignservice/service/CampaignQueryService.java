package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.ContributionView;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public interface CampaignQueryService {

    CampaignSummary getCampaign(Long campaignId);

    BigDecimal getContribution(Long campaignId, UUID account);

    List<ContributionView> getContributors(Long campaignId);

    List<Long> getCampaignsOwnedBy(UUID account);

    List<CampaignSummary> getActiveCampaigns();

    List<CampaignSummary> getSuccessfulCampaigns();

    List<CampaignSummary> getVerifiedCampaigns();

    List<CampaignSummary> getPromotedCampaigns();

    long getCampaignCount();
}
