package com.openfashion.campaignservice.repository;

import com.openfashion.campaignservice.model.Campaign;
import com.openfashion.campaignservice.model.CampaignStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Campaign c WHERE c.id = :id")
    Optional<Campaign> findByIdForUpdate(@Param("id") Long id);

    List<Campaign> findAllByStatusAndDeadlineAfterOrderByIdAsc(CampaignStatus status, Instant now);

    List<Campaign> findAllByStatusOrderByIdAsc(CampaignStatus status);

    List<Campaign> findAllByVerifiedTrueOrderByIdAsc();

    List<Campaign> findAllByPromotedTrueOrderByIdAsc();

    @Query("SELECT c.id FROM Campaign c WHERE c.status = :status AND c.refundCursor < c.backerCount ORDER BY c.id")
    List<Long> findIdsWithPendingRefundSweep(@Param("status") CampaignStatus status);
}
