package com.openfashion.campaignservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Cumulative contribution of one account to one campaign. Rows are zeroed on refund,
 * never deleted, so the ordered rows double as the campaign's contributor roster.
 */
@Entity
@Table(name = "contributions", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"campaign_id", "contributor_id"}),
        @UniqueConstraint(columnNames = {"campaign_id", "roster_position"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Contribution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "campaign_id", nullable = false)
    private Long campaignId;

    @Column(name = "contributor_id", nullable = false)
    private UUID contributorId;

    @Builder.Default
    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount = BigDecimal.ZERO;

    @Column(name = "roster_position", nullable = false)
    private int rosterPosition;

    // Refunds paid so far; numbers the custody reference of the next one
    @Column(name = "refund_sequence", nullable = false)
    private int refundSequence;

    @Column(nullable = false)
    @Version
    private long version;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    public boolean hasBalance() {
        return amount.signum() > 0;
    }

    public String nextRefundKind() {
        return "refund:" + contributorId + ":" + refundSequence;
    }

    public void recordRefund() {
        amount = BigDecimal.ZERO;
        refundSequence++;
    }
}
