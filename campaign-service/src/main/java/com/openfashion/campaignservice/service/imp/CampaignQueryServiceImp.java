package com.openfashion.campaignservice.service.imp;

import com.openfashion.campaignservice.core.exceptions.CampaignNotFoundException;
import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.ContributionView;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignOwnership;
import com.openfashion.campaignservice.model.CampaignStatus;
import com.openfashion.campaignservice.model.Contribution;
import com.openfashion.campaignservice.repository.CampaignOwnershipRepository;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.repository.ContributionRepository;
import com.openfashion.campaignservice.service.CampaignQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CampaignQueryServiceImp implements CampaignQueryService {

    private final CampaignRepository campaignRepository;
    private final ContributionRepository contributionRepository;
    private final CampaignOwnershipRepository ownershipRepository;
    private final Clock clock;

    @Override
    public CampaignSummary getCampaign(Long campaignId) {
        return CampaignSummary.from(load(campaignId));
    }

    @Override
    public BigDecimal getContribution(Long campaignId, UUID account) {
        load(campaignId);
        return contributionRepository.findByCampaignIdAndContributorId(campaignId, account)
                .map(Contribution::getAmount)
                .orElse(BigDecimal.ZERO);
    }

    @Override
    public List<ContributionView> getContributors(Long campaignId) {
        load(campaignId);
        return contributionRepository.findAllByCampaignIdOrderByRosterPositionAsc(campaignId).stream()
                .map(ContributionView::from)
                .toList();
    }

    @Override
    public List<Long> getCampaignsOwnedBy(UUID account) {
        return ownershipRepository.findAllByAccountIdOrderByCampaignIdAsc(account).stream()
                .map(CampaignOwnership::getCampaignId)
                .toList();
    }

    @Override
    public List<CampaignSummary> getActiveCampaigns() {
        return summarize(campaignRepository.findAllByStatusAndDeadlineAfterOrderByIdAsc(CampaignStatus.OPEN, clock.instant()));
    }

    @Override
    public List<CampaignSummary> getSuccessfulCampaigns() {
        return summarize(campaignRepository.findAllByStatusOrderByIdAsc(CampaignStatus.FUNDED));
    }

    @Override
    public List<CampaignSummary> getVerifiedCampaigns() {
        return summarize(campaignRepository.findAllByVerifiedTrueOrderByIdAsc());
    }

    @Override
    public List<CampaignSummary> getPromotedCampaigns() {
        return summarize(campaignRepository.findAllByPromotedTrueOrderByIdAsc());
    }

    @Override
    public long getCampaignCount() {
        return campaignRepository.count();
    }

    private Campaign load(Long campaignId) {
        if (campaignId == null || campaignId < 1) {
            throw new CampaignNotFoundException(campaignId);
        }
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new CampaignNotFoundException(campaignId));
    }

    private List<CampaignSummary> summarize(List<Campaign> campaigns) {
        return campaigns.stream().map(CampaignSummary::from).toList();
    }
}
