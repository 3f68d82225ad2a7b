package com.openfashion.campaignservice.listener;

import com.openfashion.campaignservice.core.config.KafkaConfig;
import com.openfashion.campaignservice.core.exceptions.CampaignRuleException;
import com.openfashion.campaignservice.dto.event.ContributionCapturedEvent;
import com.openfashion.campaignservice.service.ContributionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class ContributionEventListener {

    private final ContributionService contributionService;

    @KafkaListener(
            topics = KafkaConfig.CONTRIBUTION_CAPTURED_TOPIC,
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "capturedKafkaListenerContainerFactory",
            autoStartup = "${app.kafka.listeners.auto-startup:true}"
    )
    public void handleContributionCaptured(ContributionCapturedEvent event, Acknowledgment acknowledgment) {
        log.info("Received captured contribution: {} for campaign {}", event.referenceId(), event.campaignId());

        try {
            contributionService.applyCapturedContribution(event);
            acknowledgment.acknowledge();
        } catch (CampaignRuleException e) {
            // Redelivery cannot change the outcome of a rejected contribution
            log.warn("Captured contribution {} rejected: {}", event.referenceId(), e.getMessage());
            acknowledgment.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing captured contribution: {}", event.referenceId(), e);
            throw e;
        }
    }
}
