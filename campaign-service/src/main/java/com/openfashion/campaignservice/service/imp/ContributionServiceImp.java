package com.openfashion.campaignservice.service.imp;

import com.openfashion.campaignservice.core.exceptions.CampaignClosedException;
import com.openfashion.campaignservice.core.exceptions.ContributionOutOfBoundsException;
import com.openfashion.campaignservice.core.exceptions.DeadlinePassedException;
import com.openfashion.campaignservice.core.exceptions.InvalidParametersException;
import com.openfashion.campaignservice.core.util.MoneyUtil;
import com.openfashion.campaignservice.dto.ContributionReceipt;
import com.openfashion.campaignservice.dto.event.CampaignEventPayload;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.dto.event.ContributionCapturedEvent;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.Contribution;
import com.openfashion.campaignservice.model.ProcessedCapture;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.repository.ContributionRepository;
import com.openfashion.campaignservice.repository.ProcessedCaptureRepository;
import com.openfashion.campaignservice.service.AccessGate;
import com.openfashion.campaignservice.service.CampaignEventPublisher;
import com.openfashion.campaignservice.service.CampaignLifecycleService;
import com.openfashion.campaignservice.service.CampaignRegistryService;
import com.openfashion.campaignservice.service.ContributionService;
import com.openfashion.campaignservice.service.PayoutExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class ContributionServiceImp implements ContributionService {

    private final CampaignRegistryService registryService;
    private final CampaignLifecycleService lifecycleService;
    private final CampaignRepository campaignRepository;
    private final ContributionRepository contributionRepository;
    private final ProcessedCaptureRepository processedCaptureRepository;
    private final CampaignEventPublisher eventPublisher;
    private final PayoutExecutor payoutExecutor;
    private final AccessGate accessGate;
    private final Clock clock;

    @Override
    @Transactional
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 4,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public ContributionReceipt contribute(Long campaignId, UUID contributor, BigDecimal amount) {
        return record(campaignId, contributor, amount, false);
    }

    @Override
    @Transactional
    @Retryable(
            retryFor = OptimisticLockingFailureException.class,
            maxAttempts = 4,
            backoff = @Backoff(delay = 50, multiplier = 2))
    public Optional<ContributionReceipt> applyCapturedContribution(ContributionCapturedEvent event) {
        if (processedCaptureRepository.existsById(event.referenceId())) {
            log.warn("Idempotency Triggered: capture {} already applied.", event.referenceId());
            return Optional.empty();
        }

        ContributionReceipt receipt = record(event.campaignId(), event.contributorId(), event.amount(), true);

        processedCaptureRepository.save(ProcessedCapture.builder()
                .referenceId(event.referenceId())
                .campaignId(event.campaignId())
                .processedAt(clock.instant())
                .build());
        return Optional.of(receipt);
    }

    private ContributionReceipt record(Long campaignId, UUID contributor, BigDecimal amount, boolean captured) {
        accessGate.requireNotPaused();
        Campaign campaign = registryService.mustExist(campaignId);
        Instant now = clock.instant();

        if (campaign.isCompleted()) {
            log.warn("Contribution to closed campaign {} rejected", campaignId);
            throw new CampaignClosedException(campaignId);
        }
        if (!now.isBefore(campaign.getDeadline())) {
            log.warn("Contribution to campaign {} after its deadline rejected", campaignId);
            throw new DeadlinePassedException(campaignId);
        }
        if (!MoneyUtil.isPositive(amount)
                || amount.compareTo(campaign.getMinContribution()) < 0
                || amount.compareTo(campaign.getMaxContribution()) > 0) {
            throw new ContributionOutOfBoundsException(amount, campaign.getMinContribution(), campaign.getMaxContribution());
        }
        if (!MoneyUtil.isValidAmount(amount)) {
            throw new InvalidParametersException("Amount has more than " + MoneyUtil.SCALE + " decimals");
        }
        if (contributor == null) {
            throw new InvalidParametersException("Contributor is required");
        }

        BigDecimal value = MoneyUtil.format(amount);

        // Captured value is native currency already in custody
        if (captured && campaign.getFundingAsset().isToken()) {
            throw new InvalidParametersException("Campaign " + campaignId + " is funded in " + campaign.getFundingAsset());
        }
        if (!captured && campaign.getFundingAsset().isToken()) {
            // Unique per attempt: a rolled back pull is returned, so a retry pulls again
            String pullKind = "contribution:" + contributor + ":" + UUID.randomUUID();
            payoutExecutor.collect(campaign, contributor, value, PayoutExecutor.reference(campaignId, pullKind));
        }

        Contribution contribution = contributionRepository.findByCampaignIdAndContributorId(campaignId, contributor)
                .orElseGet(() -> {
                    int position = campaign.getBackerCount();
                    campaign.setBackerCount(position + 1);
                    return Contribution.builder()
                            .campaignId(campaignId)
                            .contributorId(contributor)
                            .rosterPosition(position)
                            .build();
                });

        contribution.setAmount(contribution.getAmount().add(value));
        campaign.setAmountRaised(campaign.getAmountRaised().add(value));

        contributionRepository.save(contribution);
        campaignRepository.save(campaign);
        eventPublisher.publish(CampaignEventType.CONTRIBUTION_RECEIVED, campaignId, CampaignEventPayload.of(contributor, value));

        log.info("Campaign {} received {} from {}, raised {} of {}",
                campaignId, value, contributor, campaign.getAmountRaised(), campaign.getGoal());

        if (campaign.getAmountRaised().compareTo(campaign.getGoal()) >= 0) {
            lifecycleService.completeFunding(campaign);
        }

        return new ContributionReceipt(
                campaignId,
                contributor,
                value,
                contribution.getAmount(),
                campaign.getAmountRaised(),
                campaign.getStatus());
    }
}
