package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lending.reward.ledger.enums.AccrualAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Outcome of one loan event or penalty applied to the ledger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Effect of a loan event or penalty on the ledger")
public class AccrualResult {

    private Long userId;

    @Schema(description = "Order ID for per-order events, null otherwise")
    private Long orderId;

    private AccrualAction action;

    @Schema(description = "Points locked by this event")
    @Builder.Default
    private BigInteger lockedPoints = BigInteger.ZERO;

    @Schema(description = "Points minted after debt offset")
    @Builder.Default
    private BigInteger mintedPoints = BigInteger.ZERO;

    @Schema(description = "Points burned as penalty")
    @Builder.Default
    private BigInteger burnedPoints = BigInteger.ZERO;

    @Schema(description = "Penalty shortfall moved to debt")
    @Builder.Default
    private BigInteger debtAdded = BigInteger.ZERO;

    @Schema(description = "User level after the event")
    private Integer userLevel;

    public static AccrualResult of(Long userId, Long orderId, AccrualAction action) {
        return AccrualResult.builder()
                .userId(userId)
                .orderId(orderId)
                .action(action)
                .build();
    }
}
