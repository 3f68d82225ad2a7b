package com.openfashion.campaignservice.repository;

import com.openfashion.campaignservice.model.CampaignOwnership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CampaignOwnershipRepository extends JpaRepository<CampaignOwnership, Long> {

    List<CampaignOwnership> findAllByAccountIdOrderByCampaignIdAsc(UUID accountId);

    Optional<CampaignOwnership> findByCampaignId(Long campaignId);
}
