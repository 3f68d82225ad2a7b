package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class NoExcessException extends CampaignRuleException {
    public NoExcessException(Long campaignId) {
        super("No funds above the goal for campaign: " + campaignId);
    }
}
