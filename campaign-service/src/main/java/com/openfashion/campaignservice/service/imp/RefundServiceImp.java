package com.openfashion.campaignservice.service.imp;

import com.openfashion.campaignservice.core.exceptions.CampaignClosedException;
import com.openfashion.campaignservice.core.exceptions.InsufficientFundsException;
import com.openfashion.campaignservice.core.exceptions.NoContributionException;
import com.openfashion.campaignservice.core.exceptions.RefundsUnavailableException;
import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.RefundSweepResult;
import com.openfashion.campaignservice.dto.event.CampaignEventPayload;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignStatus;
import com.openfashion.campaignservice.model.Contribution;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.repository.ContributionRepository;
import com.openfashion.campaignservice.service.CampaignEventPublisher;
import com.openfashion.campaignservice.service.CampaignRegistryService;
import com.openfashion.campaignservice.service.PayoutExecutor;
import com.openfashion.campaignservice.service.RefundService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireCreator;
import static com.openfashion.campaignservice.service.imp.CampaignChecks.requireOpen;

@Service
@Slf4j
@RequiredArgsConstructor
public class RefundServiceImp implements RefundService {

    private final CampaignRegistryService registryService;
    private final CampaignRepository campaignRepository;
    private final ContributionRepository contributionRepository;
    private final CampaignEventPublisher eventPublisher;
    private final PayoutExecutor payoutExecutor;

    @Value("${app.campaign.refund-batch-size:100}")
    private int refundBatchSize;

    @Override
    @Transactional
    public CampaignSummary enableRefunds(Long campaignId, UUID caller) {
        Campaign campaign = registryService.mustExist(campaignId);
        requireCreator(campaign, caller);
        requireOpen(campaign);

        if (campaign.isRefundable()) {
            return CampaignSummary.from(campaign);
        }

        campaign.setRefundable(true);
        campaignRepository.save(campaign);
        eventPublisher.publish(CampaignEventType.REFUNDS_ENABLED, campaignId, CampaignEventPayload.detail(caller, null));

        log.info("Refunds enabled for campaign {}", campaignId);
        return CampaignSummary.from(campaign);
    }

    @Override
    @Transactional
    public BigDecimal requestRefund(Long campaignId, UUID contributor) {
        Campaign campaign = registryService.mustExist(campaignId);

        if (campaign.getStatus() == CampaignStatus.FUNDED) {
            throw new CampaignClosedException(campaignId);
        }
        if (campaign.getStatus() == CampaignStatus.OPEN && !campaign.isRefundable()) {
            log.warn("Refund requested by {} on campaign {} without refunds enabled", contributor, campaignId);
            throw new RefundsUnavailableException(campaignId);
        }

        Contribution contribution = contributionRepository.findByCampaignIdAndContributorId(campaignId, contributor)
                .filter(Contribution::hasBalance)
                .orElseThrow(() -> new NoContributionException(campaignId, contributor));

        BigDecimal refund = refundableAmount(campaign, contribution);
        if (refund.signum() == 0) {
            throw new InsufficientFundsException(campaignId, contribution.getAmount());
        }

        String reference = PayoutExecutor.reference(campaignId, contribution.nextRefundKind());
        contribution.recordRefund();
        campaign.setAmountRaised(campaign.getAmountRaised().subtract(refund));
        contributionRepository.saveAndFlush(contribution);
        campaignRepository.saveAndFlush(campaign);

        payoutExecutor.pay(campaign, contributor, refund, reference);
        eventPublisher.publish(CampaignEventType.REFUND_ISSUED, campaignId, CampaignEventPayload.of(contributor, refund));

        log.info("Refunded {} to {} from campaign {}", refund, contributor, campaignId);
        return refund;
    }

    @Override
    @Transactional
    public RefundSweepResult refundNextBatch(Campaign campaign) {
        Long campaignId = campaign.getId();
        if (campaign.isRefundSweepFinished()) {
            return new RefundSweepResult(campaignId, 0, BigDecimal.ZERO, true);
        }

        List<Contribution> batch = contributionRepository
                .findAllByCampaignIdAndRosterPositionGreaterThanEqualOrderByRosterPositionAsc(
                        campaignId, campaign.getRefundCursor(), PageRequest.of(0, refundBatchSize));

        List<PendingRefund> pending = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        int cursor = campaign.getRefundCursor();

        for (Contribution contribution : batch) {
            cursor = contribution.getRosterPosition() + 1;
            if (!contribution.hasBalance()) {
                continue;
            }

            BigDecimal refund = refundableAmount(campaign, contribution);
            if (refund.signum() == 0) {
                contribution.setAmount(BigDecimal.ZERO);
                log.warn("Campaign {} has no custody balance left for {}", campaignId, contribution.getContributorId());
                continue;
            }

            String reference = PayoutExecutor.reference(campaignId, contribution.nextRefundKind());
            contribution.recordRefund();
            campaign.setAmountRaised(campaign.getAmountRaised().subtract(refund));
            total = total.add(refund);
            pending.add(new PendingRefund(contribution.getContributorId(), refund, reference));
        }

        if (batch.isEmpty()) {
            cursor = campaign.getBackerCount();
        }
        campaign.setRefundCursor(cursor);

        contributionRepository.saveAll(batch);
        contributionRepository.flush();
        campaignRepository.saveAndFlush(campaign);

        for (PendingRefund refund : pending) {
            payoutExecutor.pay(campaign, refund.contributor(), refund.amount(), refund.reference());
            eventPublisher.publish(CampaignEventType.REFUND_ISSUED, campaignId,
                    CampaignEventPayload.of(refund.contributor(), refund.amount()));
        }

        log.info("Refund sweep of campaign {} paid {} to {} contributors, cursor at {}/{}",
                campaignId, total, pending.size(), cursor, campaign.getBackerCount());

        return new RefundSweepResult(campaignId, pending.size(), total, campaign.isRefundSweepFinished());
    }

    // Partial withdrawals can leave custody short of the recorded contributions
    private BigDecimal refundableAmount(Campaign campaign, Contribution contribution) {
        BigDecimal available = campaign.getCustodyBalance().max(BigDecimal.ZERO);
        return contribution.getAmount().min(available);
    }

    private record PendingRefund(UUID contributor, BigDecimal amount, String reference) {}
}
