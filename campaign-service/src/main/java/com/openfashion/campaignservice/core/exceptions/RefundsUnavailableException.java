package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class RefundsUnavailableException extends CampaignRuleException {
    public RefundsUnavailableException(Long campaignId) {
        super("Refunds are not enabled for campaign: " + campaignId);
    }
}
