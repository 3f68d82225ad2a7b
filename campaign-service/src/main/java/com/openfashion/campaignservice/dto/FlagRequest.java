package com.openfashion.campaignservice.dto;

public record FlagRequest(
        boolean value
) {
}
