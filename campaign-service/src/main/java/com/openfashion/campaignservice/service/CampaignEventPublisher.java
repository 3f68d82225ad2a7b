package com.openfashion.campaignservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openfashion.campaignservice.dto.event.CampaignEvent;
import com.openfashion.campaignservice.dto.event.CampaignEventPayload;
import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.OutboxEvent;
import com.openfashion.campaignservice.model.OutboxStatus;
import com.openfashion.campaignservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.serializer.support.SerializationFailedException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes campaign events to the outbox table inside the caller's transaction.
 * The {@code OutboxPoller} ships them to Kafka after commit.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CampaignEventPublisher {

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void publish(CampaignEventType type, Long campaignId, CampaignEventPayload payload) {
        Instant now = clock.instant();
        CampaignEvent event = new CampaignEvent(UUID.randomUUID(), type, campaignId, now, payload);

        try {
            String jsonPayload = objectMapper.writeValueAsString(event);

            OutboxEvent outboxEvent = OutboxEvent.builder()
                    .aggregateId(String.valueOf(campaignId))
                    .eventType(type.name())
                    .payload(jsonPayload)
                    .status(OutboxStatus.PENDING)
                    .createdAt(now)
                    .build();

            outboxRepository.save(outboxEvent);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} event for campaign {}", type, campaignId, e);
            throw new SerializationFailedException("Serialization failure", e);
        }
    }
}
