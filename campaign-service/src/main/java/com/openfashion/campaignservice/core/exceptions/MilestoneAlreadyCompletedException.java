package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class MilestoneAlreadyCompletedException extends CampaignRuleException {
    public MilestoneAlreadyCompletedException(Long campaignId, int index) {
        super("Milestone " + index + " of campaign " + campaignId + " is already completed");
    }
}
