package com.openfashion.campaignservice.service.imp;

import com.openfashion.campaignservice.core.exceptions.InvalidParametersException;
import com.openfashion.campaignservice.core.util.MoneyUtil;
import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.RefundSweepResult;
import com.openfashion.campaignservice.dto.event.CampaignEventPayload;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignStatus;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.service.CampaignEventPublisher;
import com.openfashion.campaignservice.service.CampaignLifecycleService;
import com.openfashion.campaignservice.service.CampaignRegistryService;
import com.openfashion.campaignservice.service.FeeSplit;
import com.openfashion.campaignservice.service.PayoutExecutor;
import com.openfashion.campaignservice.service.RefundService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireCreator;
import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireOpen;

@Service
@Slf4j
@RequiredArgsConstructor
public class CampaignLifecycleServiceImp implements CampaignLifecycleService {

    private final CampaignRegistryService registryService;
    private final RefundService refundService;
    private final CampaignRepository campaignRepository;
    private final CampaignEventPublisher eventPublisher;
    private final PayoutExecutor payoutExecutor;
    private final Clock clock;

    @Override
    @Transactional
    public void completeFunding(Campaign campaign) {
        if (campaign.getStatus() != CampaignStatus.OPEN) {
            return;
        }

        // Milestone amounts stay in custody until each milestone is completed
        BigDecimal release = campaign.getGoal().subtract(campaign.getMilestoneTotal());

        campaign.setStatus(CampaignStatus.FUNDED);
        campaign.setFundedAt(clock.instant());
        campaign.setAmountReleased(campaign.getAmountReleased().add(release));
        campaignRepository.saveAndFlush(campaign);

        eventPublisher.publish(CampaignEventType.CAMPAIGN_FUNDED, campaign.getId(),
                CampaignEventPayload.of(campaign.getCreatorId(), campaign.getAmountRaised()));
        log.info("Campaign {} funded with {} raised against a goal of {}",
                campaign.getId(), campaign.getAmountRaised(), campaign.getGoal());

        if (release.signum() > 0) {
            FeeSplit split = payoutExecutor.payCreatorWithFee(campaign, release,
                    PayoutExecutor.reference(campaign.getId(), "funding"));
            eventPublisher.publish(CampaignEventType.FUNDING_PAYOUT, campaign.getId(),
                    new CampaignEventPayload(campaign.getCreatorId(), split.net(), split.fee(), null));
            log.info("Campaign {} funding payout: {} to creator, {} fee", campaign.getId(), split.net(), split.fee());
        }
    }

    @Override
    @Transactional
    public RefundSweepResult cancelCampaign(Long campaignId, UUID caller) {
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireOpen(campaign);

        campaign.setStatus(CampaignStatus.CANCELLED);
        campaign.setCancelledAt(clock.instant());
        campaignRepository.saveAndFlush(campaign);

        eventPublisher.publish(CampaignEventType.CAMPAIGN_CANCELLED, campaignId,
                CampaignEventPayload.of(caller, campaign.getAmountRaised()));
        log.info("Campaign {} cancelled by creator, refunding {} backers", campaignId, campaign.getBackerCount());

        return refundService.refundNextBatch(campaign);
    }

    @Override
    @Transactional
    public RefundSweepResult continueRefundSweep(Long campaignId) {
        Campaign campaign = registryService.mustExist(campaignId);
        if (campaign.getStatus() != CampaignStatus.CANCELLED) {
            throw new InvalidParametersException("Campaign " + campaignId + " is not cancelled");
        }
        return refundService.refundNextBatch(campaign);
    }

    @Override
    @Transactional
    public CampaignSummary modifyGoal(Long campaignId, UUID caller, BigDecimal newGoal) {
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireOpen(campaign);

        if (!MoneyUtil.isValidAmount(newGoal)) {
            throw new InvalidParametersException("Goal must be a positive amount with at most 4 decimals");
        }
        if (newGoal.compareTo(campaign.getAmountRaised()) <= 0) {
            log.warn("Goal {} for campaign {} is not above the raised amount {}", newGoal, campaignId, campaign.getAmountRaised());
            throw new InvalidParametersException("New goal must exceed the amount already raised");
        }
        if (newGoal.compareTo(campaign.getMilestoneTotal()) < 0) {
            throw new InvalidParametersException("New goal must cover the total milestone amount");
        }

        BigDecimal previous = campaign.getGoal();
        campaign.setGoal(MoneyUtil.format(newGoal));
        campaignRepository.save(campaign);

        eventPublisher.publish(CampaignEventType.GOAL_MODIFIED, campaignId,
                new CampaignEventPayload(caller, campaign.getGoal(), null, "previous " + previous));
        log.info("Campaign {} goal changed from {} to {}", campaignId, previous, campaign.getGoal());
        return CampaignSummary.from(campaign);
    }

    @Override
    @Transactional
    public CampaignSummary extendDeadline(Long campaignId, UUID caller, int additionalDays) {
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireOpen(campaign);

        if (additionalDays <= 0) {
            throw new InvalidParametersException("Extension must be at least one day");
        }

        campaign.setDeadline(campaign.getDeadline().plus(Duration.ofDays(additionalDays)));
        campaignRepository.save(campaign);

        eventPublisher.publish(CampaignEventType.DEADLINE_EXTENDED, campaignId,
                CampaignEventPayload.detail(caller, campaign.getDeadline().toString()));
        log.info("Campaign {} deadline extended by {} days to {}", campaignId, additionalDays, campaign.getDeadline());
        return CampaignSummary.from(campaign);
    }
}
