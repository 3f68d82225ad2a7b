package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.RefundSweepResult;
import com.openfashion.campaignservice.model.Campaign;

import java.math.BigDecimal;
import java.util.UUID;

public interface RefundService {

    CampaignSummary enableRefunds(Long campaignId, UUID caller);

    BigDecimal requestRefund(Long campaignId, UUID contributor);

    /**
     * Refunds the next roster batch of a locked, cancelled campaign.
     */
    RefundSweepResult refundNextBatch(Campaign campaign);
}
