package com.openfashion.campaignservice.repository;

import com.openfashion.campaignservice.model.Contribution;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContributionRepository extends JpaRepository<Contribution, Long> {

    Optional<Contribution> findByCampaignIdAndContributorId(Long campaignId, UUID contributorId);

    List<Contribution> findAllByCampaignIdOrderByRosterPositionAsc(Long campaignId);

    List<Contribution> findAllByCampaignIdAndRosterPositionGreaterThanEqualOrderByRosterPositionAsc(
            Long campaignId, int fromPosition, Pageable page);
}
