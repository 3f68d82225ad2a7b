package com.openfashion.campaignservice.client.custody.dto;

import java.util.UUID;

public record CustodyTransferResponse(
        UUID transactionId,
        CustodyTransferStatus status,
        String reasonCode
) {
}
