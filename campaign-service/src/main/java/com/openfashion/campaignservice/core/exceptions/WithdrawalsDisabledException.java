package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class WithdrawalsDisabledException extends CampaignRuleException {
    public WithdrawalsDisabledException(Long campaignId) {
        super("Partial withdrawals are disabled for campaign: " + campaignId);
    }
}
