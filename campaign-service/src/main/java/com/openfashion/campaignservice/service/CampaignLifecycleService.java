package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.RefundSweepResult;
import com.openfashion.campaignservice.model.Campaign;

import java.math.BigDecimal;
import java.util.UUID;

public interface CampaignLifecycleService {

    /**
     * Moves a locked OPEN campaign to FUNDED and pays the funding release. Must run
     * inside the contribution's transaction.
     */
    void completeFunding(Campaign campaign);

    RefundSweepResult cancelCampaign(Long campaignId, UUID caller);

    RefundSweepResult continueRefundSweep(Long campaignId);

    CampaignSummary modifyGoal(Long campaignId, UUID caller, BigDecimal newGoal);

    CampaignSummary extendDeadline(Long campaignId, UUID caller, int additionalDays);
}
