package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.math.BigDecimal;

@ResponseStatus(HttpStatus.PAYMENT_REQUIRED)
public class InsufficientFundsException extends CampaignRuleException {
    public InsufficientFundsException(Long campaignId, BigDecimal requested) {
        super("Insufficient funds on campaign " + campaignId + " for " + requested);
    }
}
