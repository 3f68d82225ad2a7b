package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class CampaignClosedException extends CampaignRuleException {
    public CampaignClosedException(Long campaignId) {
        super("Campaign " + campaignId + " is already completed or cancelled");
    }
}
