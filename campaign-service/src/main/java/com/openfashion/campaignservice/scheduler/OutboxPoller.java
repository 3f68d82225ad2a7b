package com.openfashion.campaignservice.scheduler;

import com.openfashion.campaignservice.dto.event.CampaignEventType;
import com.openfashion.campaignservice.model.OutboxEvent;
import com.openfashion.campaignservice.model.OutboxStatus;
import com.openfashion.campaignservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class OutboxPoller {

    private static final String UNKNOWN_TOPIC = "campaign.unknown";
    private static final int DELAY = 2000;
    private static final int LIMIT = 100;

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;

    @Scheduled(fixedDelay = DELAY)
    @Transactional
    public void processOutboxEvents() {
        List<OutboxEvent> events = outboxRepository.findTopForProcessing(LIMIT);

        if (events.isEmpty()) return;

        log.info("Polling outbox: found {} events to publish", events.size());

        for (OutboxEvent event : events) {
            try {
                String targetTopic = determineTopic(event.getEventType());

                // Keyed by campaign id so consumers see one campaign's events in order
                kafkaTemplate.send(targetTopic, event.getAggregateId(), event.getPayload())
                        .get(3, TimeUnit.SECONDS);

                event.setStatus(OutboxStatus.PROCESSED);
                outboxRepository.save(event);

                log.debug("Published event {} ({}) to topic {}", event.getId(), event.getEventType(), targetTopic);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Thread was interrupted while sending event {}", event.getId());
                return;
            } catch (ExecutionException | TimeoutException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Failed to publish outbox event {}: {}", event.getId(), cause.getMessage());
                // Stop here so later events of the same campaign are not published ahead of this one
                return;
            }
        }
    }

    String determineTopic(String eventType) {
        try {
            return CampaignEventType.valueOf(eventType).topic();
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Outbox event type {} has no topic mapping", eventType);
            return UNKNOWN_TOPIC;
        }
    }
}
