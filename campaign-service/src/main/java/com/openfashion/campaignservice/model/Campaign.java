package com.openfashion.campaignservice.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.Digits;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "campaigns", indexes = {
        @Index(name = "idx_campaign_creator", columnList = "creator_id"),
        @Index(name = "idx_campaign_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID creatorId;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 4000)
    private String description;

    @Column(length = 500)
    private String mediaReference;

    @Column(length = 50)
    private String category;

    @Column(nullable = false, precision = 19, scale = 4)
    @Digits(integer = 15, fraction = 4)
    private BigDecimal goal;

    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amountRaised = BigDecimal.ZERO;

    // Paid to the creator without reducing amountRaised: funding payout and milestones
    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amountReleased = BigDecimal.ZERO;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal minContribution;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal maxContribution;

    @Column(nullable = false)
    private Instant deadline;

    @Embedded
    private FundingAsset fundingAsset;

    @Builder.Default
    @Column(nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private CampaignStatus status = CampaignStatus.OPEN;

    private boolean refundable;

    private boolean verified;

    private boolean promoted;

    private int backerCount;

    // Next roster position the cancellation sweep will visit
    private int refundCursor;

    @Embedded
    @Builder.Default
    private WithdrawalPolicy withdrawalPolicy = WithdrawalPolicy.disabled();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_milestones", joinColumns = @JoinColumn(name = "campaign_id"))
    @OrderColumn(name = "milestone_index")
    private List<Milestone> milestones = new ArrayList<>();

    private Instant fundedAt;

    private Instant cancelledAt;

    @Column(nullable = false)
    @Version
    private long version;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public boolean isCompleted() {
        return status != CampaignStatus.OPEN;
    }

    public boolean isRefundSweepFinished() {
        return refundCursor >= backerCount;
    }

    public BigDecimal getMilestoneTotal() {
        return milestones.stream()
                .map(Milestone::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCustodyBalance() {
        return amountRaised.subtract(amountReleased);
    }
}
