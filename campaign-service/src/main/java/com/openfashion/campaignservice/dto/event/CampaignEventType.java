package com.openfashion.campaignservice.dto.event;

import com.openfashion.campaignservice.core.config.KafkaConfig;

public enum CampaignEventType {

    CAMPAIGN_CREATED(KafkaConfig.LIFECYCLE_TOPIC),
    CAMPAIGN_UPDATED(KafkaConfig.LIFECYCLE_TOPIC),
    OWNERSHIP_TRANSFERRED(KafkaConfig.LIFECYCLE_TOPIC),
    FUNDING_ASSET_CHANGED(KafkaConfig.LIFECYCLE_TOPIC),
    GOAL_MODIFIED(KafkaConfig.LIFECYCLE_TOPIC),
    DEADLINE_EXTENDED(KafkaConfig.LIFECYCLE_TOPIC),
    REFUNDS_ENABLED(KafkaConfig.LIFECYCLE_TOPIC),
    WITHDRAWALS_CONFIGURED(KafkaConfig.LIFECYCLE_TOPIC),
    MILESTONE_ADDED(KafkaConfig.LIFECYCLE_TOPIC),
    CAMPAIGN_FUNDED(KafkaConfig.LIFECYCLE_TOPIC),
    CAMPAIGN_CANCELLED(KafkaConfig.LIFECYCLE_TOPIC),

    CONTRIBUTION_RECEIVED(KafkaConfig.CONTRIBUTIONS_TOPIC),
    REFUND_ISSUED(KafkaConfig.CONTRIBUTIONS_TOPIC),

    FUNDING_PAYOUT(KafkaConfig.PAYOUTS_TOPIC),
    SURPLUS_WITHDRAWN(KafkaConfig.PAYOUTS_TOPIC),
    PARTIAL_WITHDRAWAL(KafkaConfig.PAYOUTS_TOPIC),
    MILESTONE_COMPLETED(KafkaConfig.PAYOUTS_TOPIC);

    private final String topic;

    CampaignEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
