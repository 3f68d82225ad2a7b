package com.openfashion.campaignservice.dto;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record OwnershipTransferRequest(
        @NotNull UUID newCreator
) {
}
