package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidParametersException extends CampaignRuleException {
    public InvalidParametersException(String reason) {
        super(reason);
    }
}
