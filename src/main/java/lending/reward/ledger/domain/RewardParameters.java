package lending.reward.ledger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Administrative knobs for reward estimation, penalties and upgrade pricing.
 * Stored as a single row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RewardParameters {
    /**
     * Base USD value per reward unit (18 decimals)
     */
    private BigInteger baseUsd;

    private Long perDay;

    /**
     * Bonus for a healthy position, basis points
     */
    private Integer bonusBps;

    /**
     * Estimated total (18 decimals) above which the dynamic multiplier applies
     */
    private BigInteger dynamicThreshold;

    private Integer dynamicMultiplierBps;

    private Long cacheExpirySeconds;

    /**
     * Half-width of the on-time window around maturity
     */
    private Long onTimeWindowSeconds;

    private Integer earlyPenaltyBps;

    private Integer latePenaltyBps;

    /**
     * Upgrade cost multiplier applied to the target level price, basis points
     */
    private Integer upgradeMultiplierBps;

    private LocalDateTime updatedAt;
}
