package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class NoContributionException extends CampaignRuleException {
    public NoContributionException(Long campaignId, UUID contributorId) {
        super("No refundable contribution from " + contributorId + " to campaign " + campaignId);
    }
}
