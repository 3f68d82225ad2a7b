package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.PayoutResult;
import com.openfashion.campaignservice.dto.WithdrawalSettingsRequest;

import java.math.BigDecimal;
import java.util.UUID;

public interface WithdrawalService {

    PayoutResult withdrawSurplus(Long campaignId, UUID caller);

    CampaignSummary configureWithdrawals(Long campaignId, UUID caller, WithdrawalSettingsRequest settings);

    PayoutResult withdrawPartialFunds(Long campaignId, UUID caller, BigDecimal amount);

    CampaignSummary addMilestone(Long campaignId, UUID caller, BigDecimal amount, String description);

    PayoutResult completeMilestone(Long campaignId, UUID caller, int milestoneIndex);
}
