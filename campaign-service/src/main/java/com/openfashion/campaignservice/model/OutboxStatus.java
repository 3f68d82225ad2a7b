package com.openfashion.campaignservice.model;

public enum OutboxStatus {
    PENDING,
    PROCESSED
}
