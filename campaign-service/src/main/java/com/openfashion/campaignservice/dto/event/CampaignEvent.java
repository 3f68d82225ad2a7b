package com.openfashion.campaignservice.dto.event;

import java.time.Instant;
import java.util.UUID;

public record CampaignEvent(
        UUID eventId,
        CampaignEventType eventType,
        Long campaignId,
        Instant timestamp,
        CampaignEventPayload payload
) {}
