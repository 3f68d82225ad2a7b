package com.openfashion.campaignservice.service;

import com.openfashion.campaignservice.dto.PlatformSettingsView;

import java.util.UUID;

public interface PlatformService {

    PlatformSettingsView pause(UUID caller);

    PlatformSettingsView unpause(UUID caller);

    PlatformSettingsView updateFeeRate(UUID caller, int basisPoints);

    PlatformSettingsView getSettings();

    int currentFeeBasisPoints();

    UUID feeRecipient();
}
