package com.openfashion.campaignservice.scheduler;

import com.openfashion.campaignservice.dto.RefundSweepResult;
import com.openfashion.campaignservice.model.CampaignStatus;
import com.openfashion.campaignservice.repository.CampaignRepository;
import com.openfashion.campaignservice.service.CampaignLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Finishes the refund sweep of cancelled campaigns whose roster did not fit in the
 * batch processed at cancellation. Each batch runs in its own transaction.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class RefundSweepScheduler {

    private final CampaignRepository campaignRepository;
    private final CampaignLifecycleService lifecycleService;

    @Scheduled(fixedDelayString = "${app.campaign.refund-sweep-delay-ms:30000}")
    public void continuePendingSweeps() {
        List<Long> pending = campaignRepository.findIdsWithPendingRefundSweep(CampaignStatus.CANCELLED);

        if (pending.isEmpty()) return;

        log.info("Continuing refund sweep for {} cancelled campaigns", pending.size());

        for (Long campaignId : pending) {
            try {
                RefundSweepResult result = lifecycleService.continueRefundSweep(campaignId);
                log.info("Campaign {} sweep batch refunded {} contributors, finished: {}",
                        campaignId, result.refundedContributors(), result.finished());
            } catch (Exception e) {
                log.error("Critical: Failed to continue refund sweep for campaign: {}", campaignId, e);
            }
        }
    }
}
