package com.openfashion.campaignservice.model;

public enum AssetType {
    NATIVE,
    TOKEN
}
