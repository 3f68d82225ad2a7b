package com.openfashion.campaignservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

// Reference ids of captured contributions already applied to the ledger
@Entity
@Table(name = "processed_captures")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedCapture {

    @Id
    @Column(length = 100)
    private String referenceId;

    @Column(nullable = false)
    private Long campaignId;

    @Column(nullable = false)
    private Instant processedAt;
}
