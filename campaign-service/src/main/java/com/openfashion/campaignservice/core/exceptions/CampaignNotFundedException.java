package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class CampaignNotFundedException extends CampaignRuleException {
    public CampaignNotFundedException(Long campaignId) {
        super("Campaign " + campaignId + " has not reached its goal");
    }
}
