package com.openfashion.campaignservice.model;

public enum CampaignStatus {
    OPEN,
    FUNDED, // Goal crossed by a contribution, terminal
    CANCELLED // Creator cancelled before funding, terminal
}
