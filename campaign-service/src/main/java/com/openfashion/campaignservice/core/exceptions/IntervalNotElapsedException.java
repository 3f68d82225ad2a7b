package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;

@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class IntervalNotElapsedException extends CampaignRuleException {
    public IntervalNotElapsedException(Long campaignId, Instant nextAllowed) {
        super("Next withdrawal for campaign " + campaignId + " allowed at " + nextAllowed);
    }
}
