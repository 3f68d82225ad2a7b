package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class PlatformPausedException extends CampaignRuleException {
    public PlatformPausedException() {
        super("Platform is paused");
    }
}
