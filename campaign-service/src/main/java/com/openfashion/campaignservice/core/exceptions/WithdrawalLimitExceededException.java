package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.math.BigDecimal;

@ResponseStatus(HttpStatus.CONFLICT)
public class WithdrawalLimitExceededException extends CampaignRuleException {
    public WithdrawalLimitExceededException(Long campaignId, BigDecimal requested) {
        super("Withdrawal of " + requested + " exceeds the ceiling of campaign " + campaignId);
    }
}
