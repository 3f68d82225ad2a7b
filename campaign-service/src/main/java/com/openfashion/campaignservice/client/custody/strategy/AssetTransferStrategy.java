package com.openfashion.campaignservice.client.custody.strategy;

import com.openfashion.campaignservice.client.custody.TransferResult;
import com.openfashion.campaignservice.client.custody.dto.CustodyTransferRequest;
import com.openfashion.campaignservice.client.custody.dto.CustodyTransferResponse;
import com.openfashion.campaignservice.client.custody.dto.CustodyTransferStatus;
import com.openfashion.campaignservice.model.AssetType;
import com.openfashion.campaignservice.model.FundingAsset;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.UUID;

@Slf4j
@RequiredArgsConstructor
public abstract class AssetTransferStrategy {

    protected final RestClient restClient;
    protected final String custodyUrl;

    public abstract boolean supports(AssetType type);

    public abstract TransferResult transfer(FundingAsset asset, UUID recipient, BigDecimal amount, String reference);

    public abstract TransferResult pull(FundingAsset asset, UUID from, BigDecimal amount, String reference);

    protected TransferResult post(String path, CustodyTransferRequest request) {
        CustodyTransferResponse response;
        try {
            response = restClient.post()
                    .uri(custodyUrl + path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(CustodyTransferResponse.class);
        } catch (Exception e) {
            log.error("Custody call {} failed for reference {}", path, request.referenceId(), e);
            return TransferResult.failed("CUSTODY_UNAVAILABLE");
        }

        if (response == null) {
            return TransferResult.failed("EMPTY_RESPONSE");
        }

        if (response.status() == CustodyTransferStatus.APPROVED) {
            return TransferResult.succeeded(String.valueOf(response.transactionId()));
        }

        log.warn("Custody declined {} for reference {}: {}", path, request.referenceId(), response.reasonCode());
        return TransferResult.failed(response.reasonCode());
    }
}
