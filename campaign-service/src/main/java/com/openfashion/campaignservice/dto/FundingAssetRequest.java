package com.openfashion.campaignservice.dto;

public record FundingAssetRequest(
        String tokenId
) {
}
