package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.dto.ContributionReceipt;
import com.openfashion.campaignservice.dto.event.ContributionCapturedEvent;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

public interface ContributionService {

    ContributionReceipt contribute(Long campaignId, UUID contributor, BigDecimal amount);

    /**
     * Applies a contribution captured by the payment service. Returns empty when the
     * capture reference was already applied.
     */
    Optional<ContributionReceipt> applyCapturedContribution(ContributionCapturedEvent event);
}
