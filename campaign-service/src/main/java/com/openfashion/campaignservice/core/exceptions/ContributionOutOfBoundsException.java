package com.openfashion.campaignservice.core.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.math.BigDecimal;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ContributionOutOfBoundsException extends CampaignRuleException {
    public ContributionOutOfBoundsException(BigDecimal amount, BigDecimal min, BigDecimal max) {
        super("Contribution " + amount + " outside of allowed range [" + min + ", " + max + "]");
    }
}
