package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.dto.CampaignDetailsUpdateRequest;
import com.openfashion.campaignservice.dto.CampaignSummary;
import com.openfashion.campaignservice.dto.CreateCampaignRequest;
import com.openfashion.campaignservice.model.Campaign;

import java.util.UUID;

public interface CampaignRegistryService {

    Long createCampaign(UUID creator, CreateCampaignRequest request);

    boolean exists(Long campaignId);

    /**
     * Loads the campaign and holds its row lock until the surrounding transaction ends.
     */
    Campaign mustExist(Long campaignId);

    CampaignSummary updateCampaignDetails(Long campaignId, UUID caller, CampaignDetailsUpdateRequest request);

    CampaignSummary transferOwnership(Long campaignId, UUID caller, UUID newCreator);

    CampaignSummary changeFundingAsset(Long campaignId, UUID caller, String tokenId);

    CampaignSummary setVerified(Long campaignId, UUID caller, boolean verified);

    CampaignSummary setPromoted(Long campaignId, UUID caller, boolean promoted);
}
