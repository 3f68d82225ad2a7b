package com.openfashion.campaignservice.dto;

public record PlatformSettingsView(
        boolean paused,
        int feeBasisPoints
) {
}
