package com.openfashion.campaignservice.core.exceptions;

/**
 * A request the campaign rules refuse. Repeating it against the same state gives the
 * same answer, unlike a failed transfer or an infrastructure error.
 */
public abstract class CampaignRuleException extends RuntimeException {
    protected CampaignRuleException(String message) {
        super(message);
    }
}
