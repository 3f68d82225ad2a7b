package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class CampaignNotFoundException extends CampaignRuleException {
    public CampaignNotFoundException(Long campaignId) {
        super("Campaign not found: " + campaignId);
    }
}
