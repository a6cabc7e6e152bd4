package lending.reward.ledger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Aggregate ledger counters. The same shape is used for the stored totals and for
 * the delta applied by a single operation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerStatistics {
    @Builder.Default
    private Long totalBatchOperations = 0L;

    @Builder.Default
    private BigInteger totalPointsMinted = BigInteger.ZERO;

    @Builder.Default
    private BigInteger totalPointsBurned = BigInteger.ZERO;

    @Builder.Default
    private BigInteger totalPointsForfeited = BigInteger.ZERO;

    @Builder.Default
    private BigInteger totalDebtRecorded = BigInteger.ZERO;

    @Builder.Default
    private Long totalConsumptions = 0L;

    /**
     * Current size of the reward estimate cache, filled in on read
     */
    @Builder.Default
    private Long totalCachedRewards = 0L;

    private LocalDateTime updatedAt;
}
