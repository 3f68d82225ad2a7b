package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.UUID;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class UnauthorizedException extends CampaignRuleException {
    public UnauthorizedException(UUID caller) {
        super("Account " + caller + " is not allowed to perform this operation");
    }
}
