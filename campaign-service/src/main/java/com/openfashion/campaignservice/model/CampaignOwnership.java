package com.openfashion.campaignservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(name = "campaign_ownerships", indexes = {
        @Index(name = "idx_ownership_account", columnList = "account_id")
}, uniqueConstraints = {
        @UniqueConstraint(columnNames = {"campaign_id"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignOwnership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;
}
