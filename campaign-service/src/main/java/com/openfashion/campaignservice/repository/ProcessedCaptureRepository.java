package com.openfashion.campaignservice.repository;

import com.openfashion.campaignservice.model.ProcessedCapture;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProcessedCaptureRepository extends JpaRepository<ProcessedCapture, String> {
}
