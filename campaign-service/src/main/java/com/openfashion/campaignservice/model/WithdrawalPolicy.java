package com.openfashion.campaignservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Creator withdrawal settings and the running totals checked against them.
 * <p>
 * {@code totalWithdrawn} counts partial withdrawals and milestone releases; it never
 * exceeds {@code ceiling} while {@code limitEnabled} is set.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawalPolicy {

    @Column(name = "partial_withdrawals_enabled", nullable = false)
    private boolean partialWithdrawalsEnabled;

    @Column(name = "withdrawal_limit_enabled", nullable = false)
    private boolean limitEnabled;

    @Column(name = "withdrawal_ceiling", precision = 19, scale = 4)
    private BigDecimal ceiling;

    @Builder.Default
    @Column(name = "total_withdrawn", nullable = false, precision = 19, scale = 4)
    private BigDecimal totalWithdrawn = BigDecimal.ZERO;

    // Partial withdrawals paid so far; numbers the custody reference of the next one
    @Column(name = "withdrawal_sequence", nullable = false)
    private int withdrawalSequence;

    @Column(name = "last_withdrawal_at")
    private Instant lastWithdrawalAt;

    @Column(name = "min_interval_seconds", nullable = false)
    private long minIntervalSeconds;

    public static WithdrawalPolicy disabled() {
        return WithdrawalPolicy.builder().build();
    }

    public boolean exceedsCeiling(BigDecimal amount) {
        return limitEnabled && totalWithdrawn.add(amount).compareTo(ceiling) > 0;
    }

    public boolean intervalElapsed(Instant now) {
        if (minIntervalSeconds <= 0 || lastWithdrawalAt == null) {
            return true;
        }
        return !now.isBefore(lastWithdrawalAt.plus(Duration.ofSeconds(minIntervalSeconds)));
    }

    public void recordWithdrawal(BigDecimal amount, Instant now) {
        withdrawalSequence++;
        totalWithdrawn = totalWithdrawn.add(amount);
        lastWithdrawalAt = now;
    }
}
