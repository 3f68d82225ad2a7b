package com.openfashion.campaignservice.dto.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published by the payment service once a native-currency contribution has been captured.
 */
public record ContributionCapturedEvent(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("referenceId") String referenceId,
        @JsonProperty("campaignId") Long campaignId,
        @JsonProperty("contributorId") UUID contributorId,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("timestamp") Instant timestamp
) {}
