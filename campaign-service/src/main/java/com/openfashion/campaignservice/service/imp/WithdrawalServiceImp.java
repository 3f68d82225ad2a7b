package com.openfashion.campaignservice.service.imp;

import com.openfashion.campaignservice.core.exceptions.InsufficientFundsException;
import com.openfashion.campaignservice.core.exceptions.IntervalNotElapsedException;
import com.openfashion.campaignservice.core.exceptions.InvalidParametersException;
import com.openfashion.campaignservice.core.exceptions.MilestoneAlreadyCompletedException;
import com.openfashion.campaignservice.core.exceptions.NoExcessException;
import com.openfashion.campaignservice.core.exceptions.WithdrawalLimitExceededException;
import com.openfashion.campaignservice.core.exceptions.WithdrawalsDisabledException;
import com.openfashion.campaignservice.core.util.MoneyUtil;
import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.PayoutResult;
import com.openfashion.campaignservice.dto.WithdrawalSettingsRequest;
import com.openfashion.campaignservice.dto.event.CampaignEventPayload;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.Milestone;
import com.openfashion.campaignservice.model.WithdrawalPolicy;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.service.AccessGate;
import com.openfashion.campaignservice.service.CampaignEventPublisher;
import com.openfashion.campaignservice.service.CampaignRegistryService;
import com.openfashion.campaignservice.service.FeeSplit;
import com.openfashion.campaignservice.service.PayoutExecutor;
import com.openfashion.campaignservice.service.WithdrawalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static com.openfashion.campaignservice.service.imp.CampaignChecks.hasText;
import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireCreator;
import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireFunded;
import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireOpen;

@Service
@Slf4j
@RequiredArgsConstructor
public class WithdrawalServiceImp implements WithdrawalService {

    private final CampaignRegistryService registryService;
    private final CampaignRepository campaignRepository;
    private final CampaignEventPublisher eventPublisher;
    private final PayoutExecutor payoutExecutor;
    private final AccessGate accessGate;
    private final Clock clock;

    @Value("${app.campaign.max-milestones:10}")
    private int maxMilestones;

    @Override
    @Transactional
    public PayoutResult withdrawSurplus(Long campaignId, UUID caller) {
        accessGate.requireNotPaused();
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireFunded(campaign);

        BigDecimal excess = campaign.getAmountRaised().subtract(campaign.getGoal());
        if (excess.signum() <= 0) {
            throw new NoExcessException(campaignId);
        }

        campaign.setAmountRaised(campaign.getAmountRaised().subtract(excess));
        campaignRepository.saveAndFlush(campaign);

        FeeSplit split = payoutExecutor.payCreatorWithFee(campaign, excess, PayoutExecutor.reference(campaignId, "surplus"));
        eventPublisher.publish(CampaignEventType.SURPLUS_WITHDRAWN, campaignId,
                new CampaignEventPayload(caller, split.net(), split.fee(), null));

        log.info("Campaign {} surplus {} withdrawn, fee {}", campaignId, excess, split.fee());
        return PayoutResult.of(campaignId, split);
    }

    @Override
    @Transactional
    public CampaignSummary configureWithdrawals(Long campaignId, UUID caller, WithdrawalSettingsRequest settings) {
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireOpen(campaign);

        WithdrawalPolicy policy = campaign.getWithdrawalPolicy();
        if (settings.limitEnabled()) {
            if (!MoneyUtil.isPositive(settings.ceiling())) {
                throw new InvalidParametersException("A withdrawal limit needs a positive ceiling");
            }
            if (settings.ceiling().compareTo(policy.getTotalWithdrawn()) < 0) {
                throw new InvalidParametersException("Ceiling is below the amount already withdrawn");
            }
        }
        if (settings.minIntervalSeconds() < 0) {
            throw new InvalidParametersException("Minimum interval must not be negative");
        }

        policy.setPartialWithdrawalsEnabled(settings.partialWithdrawalsEnabled());
        policy.setLimitEnabled(settings.limitEnabled());
        policy.setCeiling(settings.ceiling() == null ? null : MoneyUtil.format(settings.ceiling()));
        policy.setMinIntervalSeconds(settings.minIntervalSeconds());
        campaignRepository.save(campaign);

        eventPublisher.publish(CampaignEventType.WITHDRAWALS_CONFIGURED, campaignId,
                new CampaignEventPayload(caller, policy.getCeiling(), null,
                        "partial=" + policy.isPartialWithdrawalsEnabled() + ", limit=" + policy.isLimitEnabled()));

        log.info("Campaign {} withdrawal settings updated", campaignId);
        return CampaignSummary.from(campaign);
    }

    @Override
    @Transactional
    public PayoutResult withdrawPartialFunds(Long campaignId, UUID caller, BigDecimal amount) {
        accessGate.requireNotPaused();
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireOpen(campaign);

        WithdrawalPolicy policy = campaign.getWithdrawalPolicy();
        if (!policy.isPartialWithdrawalsEnabled()) {
            throw new WithdrawalsDisabledException(campaignId);
        }
        if (!MoneyUtil.isValidAmount(amount)) {
            throw new InvalidParametersException("Amount must be positive with at most 4 decimals");
        }
        if (amount.compareTo(campaign.getAmountRaised()) > 0) {
            log.warn("Partial withdrawal of {} from campaign {} exceeds raised {}", amount, campaignId, campaign.getAmountRaised());
            throw new InsufficientFundsException(campaignId, amount);
        }

        Instant now = clock.instant();
        if (!policy.intervalElapsed(now)) {
            Instant nextAllowed = policy.getLastWithdrawalAt().plus(Duration.ofSeconds(policy.getMinIntervalSeconds()));
            throw new IntervalNotElapsedException(campaignId, nextAllowed);
        }
        if (policy.exceedsCeiling(amount)) {
            throw new WithdrawalLimitExceededException(campaignId, amount);
        }

        BigDecimal value = MoneyUtil.format(amount);
        String reference = PayoutExecutor.reference(campaignId, "partial-" + policy.getWithdrawalSequence());
        campaign.setAmountRaised(campaign.getAmountRaised().subtract(value));
        policy.recordWithdrawal(value, now);
        campaignRepository.saveAndFlush(campaign);

        FeeSplit split = payoutExecutor.payCreatorWithFee(campaign, value, reference);
        eventPublisher.publish(CampaignEventType.PARTIAL_WITHDRAWAL, campaignId,
                new CampaignEventPayload(caller, split.net(), split.fee(), null));

        log.info("Campaign {} partial withdrawal of {}, total withdrawn {}", campaignId, value, policy.getTotalWithdrawn());
        return PayoutResult.of(campaignId, split);
    }

    @Override
    @Transactional
    public CampaignSummary addMilestone(Long campaignId, UUID caller, BigDecimal amount, String description) {
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireOpen(campaign);

        if (!MoneyUtil.isValidAmount(amount)) {
            throw new InvalidParametersException("Milestone amount must be positive with at most 4 decimals");
        }
        if (!hasText(description)) {
            throw new InvalidParametersException("Milestone description is required");
        }
        if (campaign.getMilestones().size() >= maxMilestones) {
            throw new InvalidParametersException("A campaign has at most " + maxMilestones + " milestones");
        }
        if (campaign.getMilestoneTotal().add(amount).compareTo(campaign.getGoal()) > 0) {
            throw new InvalidParametersException("Milestone total would exceed the campaign goal");
        }

        campaign.getMilestones().add(new Milestone(MoneyUtil.format(amount), description.trim(), false));
        campaignRepository.save(campaign);

        eventPublisher.publish(CampaignEventType.MILESTONE_ADDED, campaignId,
                new CampaignEventPayload(caller, MoneyUtil.format(amount), null, description.trim()));

        log.info("Campaign {} milestone {} added for {}", campaignId, campaign.getMilestones().size() - 1, amount);
        return CampaignSummary.from(campaign);
    }

    @Override
    @Transactional
    public PayoutResult completeMilestone(Long campaignId, UUID caller, int milestoneIndex) {
        accessGate.requireNotPaused();
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireFunded(campaign);

        if (milestoneIndex < 0 || milestoneIndex >= campaign.getMilestones().size()) {
            throw new InvalidParametersException("No milestone at index " + milestoneIndex);
        }

        Milestone milestone = campaign.getMilestones().get(milestoneIndex);
        if (milestone.isCompleted()) {
            throw new MilestoneAlreadyCompletedException(campaignId, milestoneIndex);
        }

        WithdrawalPolicy policy = campaign.getWithdrawalPolicy();
        BigDecimal amount = milestone.getAmount();
        if (policy.exceedsCeiling(amount)) {
            throw new WithdrawalLimitExceededException(campaignId, amount);
        }
        if (amount.compareTo(campaign.getCustodyBalance()) > 0) {
            throw new InsufficientFundsException(campaignId, amount);
        }

        campaign.getMilestones().set(milestoneIndex, milestone.markCompleted());
        campaign.setAmountReleased(campaign.getAmountReleased().add(amount));
        policy.setTotalWithdrawn(policy.getTotalWithdrawn().add(amount));
        campaignRepository.saveAndFlush(campaign);

        FeeSplit split = payoutExecutor.payCreatorWithFee(campaign, amount,
                PayoutExecutor.reference(campaignId, "milestone-" + milestoneIndex));
        eventPublisher.publish(CampaignEventType.MILESTONE_COMPLETED, campaignId,
                new CampaignEventPayload(caller, split.net(), split.fee(), "milestone " + milestoneIndex));

        log.info("Campaign {} milestone {} completed, released {}", campaignId, milestoneIndex, amount);
        return PayoutResult.of(campaignId, split);
    }
}
