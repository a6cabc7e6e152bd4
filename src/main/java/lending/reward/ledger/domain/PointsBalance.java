package lending.reward.ledger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Spendable points held by a user
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointsBalance {
    private Long userId;

    /**
     * Balance in points (18 decimals), never negative
     */
    @Builder.Default
    private BigInteger balance = BigInteger.ZERO;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
