package com.openfashion.campaignservice.client.custody.strategy;

import com.openfashion.campaignservice.client.custody.TransferResult;
import com.openfashion.campaignservice.client.custody.dto.CustodyTransferRequest;
import com.openfashion.campaignservice.model.AssetType;
import com.openfashion.campaignservice.model.FundingAsset;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.UUID;

@Component
public class TokenTransferStrategy extends AssetTransferStrategy {

    public TokenTransferStrategy(RestClient restClient, @Value("${app.custody.url}") String custodyUrl) {
        super(restClient, custodyUrl);
    }

    @Override
    public boolean supports(AssetType type) {
        return type == AssetType.TOKEN;
    }

    @Override
    public TransferResult transfer(FundingAsset asset, UUID recipient, BigDecimal amount, String reference) {
        return post("/tokens/" + asset.getTokenId() + "/transfers",
                new CustodyTransferRequest(reference, recipient, amount, asset.toString()));
    }

    @Override
    public TransferResult pull(FundingAsset asset, UUID from, BigDecimal amount, String reference) {
        return post("/tokens/" + asset.getTokenId() + "/pulls",
                new CustodyTransferRequest(reference, from, amount, asset.toString()));
    }
}
