package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DeadlinePassedException extends CampaignRuleException {
    public DeadlinePassedException(Long campaignId) {
        super("Deadline passed for campaign: " + campaignId);
    }
}
