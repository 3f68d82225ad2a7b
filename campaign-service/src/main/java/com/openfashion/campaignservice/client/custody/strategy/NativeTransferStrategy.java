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
public class NativeTransferStrategy extends AssetTransferStrategy {

    public NativeTransferStrategy(RestClient restClient, @Value("${app.custody.url}") String custodyUrl) {
        super(restClient, custodyUrl);
    }

    @Override
    public boolean supports(AssetType type) {
        return type == AssetType.NATIVE;
    }

    @Override
    public TransferResult transfer(FundingAsset asset, UUID recipient, BigDecimal amount, String reference) {
        return post("/native/payouts", new CustodyTransferRequest(reference, recipient, amount, asset.toString()));
    }

    @Override
    public TransferResult pull(FundingAsset asset, UUID from, BigDecimal amount, String reference) {
        throw new UnsupportedOperationException("Native currency is not pulled from accounts");
    }
}
