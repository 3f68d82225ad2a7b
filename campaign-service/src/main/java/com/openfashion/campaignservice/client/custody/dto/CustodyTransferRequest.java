package com.openfashion.campaignservice.client.custody.dto;

import java.math.BigDecimal;
import java.util.UUID;

public record CustodyTransferRequest(
        String referenceId,
        UUID accountId,
        BigDecimal amount,
        String asset
) {}
