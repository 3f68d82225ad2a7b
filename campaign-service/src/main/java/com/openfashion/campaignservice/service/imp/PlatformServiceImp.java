package com.openfashion.campaignservice.service.imp;

import com.openfashion.campaignservice.core.exceptions.InvalidParametersException;
import com.openfashion.campaignservice.dto.PlatformSettingsView;
import com.openfashion.campaignservice.model.PlatformSettings;
import com.openfashion.campaignservice.repository.PlatformSettingsRepository;
import com.openfashion.campaignservice.service.AccessGate;
import com.openfashion.campaignservice.service.PlatformService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class PlatformServiceImp implements PlatformService, AccessGate {

    private final PlatformSettingsRepository settingsRepository;

    @Value("${app.platform.owner}")
    private UUID platformOwner;

    @Value("${app.platform.fee-recipient}")
    private UUID feeRecipient;

    @Value("${app.platform.fee-basis-points:250}")
    private int defaultFeeBasisPoints;

    @Value("${app.platform.max-fee-basis-points:1000}")
    private int maxFeeBasisPoints;

    @Override
    public boolean isOwner(UUID caller) {
        return caller != null && caller.equals(platformOwner);
    }

    @Override
    @Transactional
    public boolean isPaused() {
        return loadSettings().isPaused();
    }

    @Override
    @Transactional
    public PlatformSettingsView pause(UUID caller) {
        requireOwner(caller);
        PlatformSettings settings = loadSettings();
        settings.setPaused(true);
        settingsRepository.save(settings);

        log.info("Platform paused by {}", caller);
        return toView(settings);
    }

    @Override
    @Transactional
    public PlatformSettingsView unpause(UUID caller) {
        requireOwner(caller);
        PlatformSettings settings = loadSettings();
        settings.setPaused(false);
        settingsRepository.save(settings);

        log.info("Platform unpaused by {}", caller);
        return toView(settings);
    }

    @Override
    @Transactional
    public PlatformSettingsView updateFeeRate(UUID caller, int basisPoints) {
        requireOwner(caller);
        if (basisPoints < 0 || basisPoints > maxFeeBasisPoints) {
            log.warn("Rejected fee rate {} bps, cap is {} bps", basisPoints, maxFeeBasisPoints);
            throw new InvalidParametersException("Fee rate must be between 0 and " + maxFeeBasisPoints + " basis points");
        }

        PlatformSettings settings = loadSettings();
        int previous = settings.getFeeBasisPoints();
        settings.setFeeBasisPoints(basisPoints);
        settingsRepository.save(settings);

        log.info("Platform fee changed from {} to {} bps", previous, basisPoints);
        return toView(settings);
    }

    @Override
    @Transactional
    public PlatformSettingsView getSettings() {
        return toView(loadSettings());
    }

    @Override
    @Transactional
    public int currentFeeBasisPoints() {
        return loadSettings().getFeeBasisPoints();
    }

    @Override
    public UUID feeRecipient() {
        return feeRecipient;
    }

    private PlatformSettings loadSettings() {
        return settingsRepository.findById(PlatformSettings.SINGLETON_ID)
                .orElseGet(() -> {
                    log.info("Initializing platform settings with a fee of {} bps", defaultFeeBasisPoints);
                    return settingsRepository.save(PlatformSettings.builder()
                            .id(PlatformSettings.SINGLETON_ID)
                            .paused(false)
                            .feeBasisPoints(defaultFeeBasisPoints)
                            .build());
                });
    }

    private PlatformSettingsView toView(PlatformSettings settings) {
        return new PlatformSettingsView(settings.isPaused(), settings.getFeeBasisPoints());
    }
}
