package com.openfashion.campaignservice.service.imp;

import com.openfashion.campaignservice.core.exceptions.CampaignClosedException;
import com.openfashion.campaignservice.core.exceptions.CampaignNotFundedException;
import com.openfashion.campaignservice.core.exceptions.UnauthorizedException;
import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignStatus;

import java.util.UUID;

final class CampaignChecks {

    private CampaignChecks() {}

    static void requireCreator(Campaign campaign, UUID caller) {
        if (caller == null || !caller.equals(campaign.getCreatorId())) {
            throw new UnauthorizedException(caller);
        }
    }

    static void requireOpen(Campaign campaign) {
        if (campaign.isCompleted()) {
            throw new CampaignClosedException(campaign.getId());
        }
    }

    static void requireFunded(Campaign campaign) {
        if (campaign.getStatus() != CampaignStatus.FUNDED) {
            throw new CampaignNotFundedException(campaign.getId());
        }
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
