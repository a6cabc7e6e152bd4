package lending.reward.ledger.domain;

import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Immutable receipt of a service purchase or upgrade
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsumptionRecord {
    /**
     * Auto-generated record ID, also the per-user history order
     */
    private Long id;

    private Long userId;

    /**
     * Points burned for this purchase (18 decimals)
     */
    private BigInteger points;

    /**
     * Epoch seconds of the purchase
     */
    private Long consumedAt;

    private ServiceType serviceType;

    private ServiceLevel serviceLevel;

    /**
     * Epoch seconds after which the purchase no longer grants access
     */
    private Long expirationTime;

    @Builder.Default
    private Boolean upgrade = Boolean.FALSE;

    public boolean isActiveAt(long epochSeconds) {
        return expirationTime != null && expirationTime > epochSeconds;
    }
}
