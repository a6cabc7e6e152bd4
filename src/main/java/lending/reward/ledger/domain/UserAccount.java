package lending.reward.ledger.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Per-user accrual state: aggregate lock, penalty debt, tier and lifetime activity counters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount {
    /**
     * User ID (primary key)
     */
    private Long userId;

    /**
     * Tier level, 1..5
     */
    @Builder.Default
    private Integer userLevel = 1;

    /**
     * Points locked by the aggregate loan-event path (18 decimals)
     */
    @Builder.Default
    private BigInteger lockedPoints = BigInteger.ZERO;

    /**
     * Maturity of the aggregate lock in epoch seconds, 0 when nothing is locked
     */
    @Builder.Default
    private Long lockedMaturity = 0L;

    /**
     * Outstanding penalty that could not be burned (18 decimals)
     */
    @Builder.Default
    private BigInteger debt = BigInteger.ZERO;

    /**
     * Epoch seconds of the last loan event or penalty
     */
    @Builder.Default
    private Long lastActivity = 0L;

    @Builder.Default
    private Long totalLoanCount = 0L;

    /**
     * Lifetime borrowed principal (6 decimals)
     */
    @Builder.Default
    private BigInteger totalVolume = BigInteger.ZERO;

    @Builder.Default
    private Long eligibleLoanCount = 0L;

    @Builder.Default
    private Long onTimeRepayCount = 0L;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Fresh level-1 account with all counters at zero
     */
    public static UserAccount newAccount(Long userId) {
        return UserAccount.builder()
                .userId(userId)
                .build();
    }

    @JsonIgnore
    public boolean hasAggregateLock() {
        return lockedPoints != null && lockedPoints.signum() > 0;
    }
}
