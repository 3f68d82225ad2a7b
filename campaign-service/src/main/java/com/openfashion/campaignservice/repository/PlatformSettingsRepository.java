package com.openfashion.campaignservice.repository;

import com.openfashion.campaignservice.model.PlatformSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlatformSettingsRepository extends JpaRepository<PlatformSettings, Integer> {
}
