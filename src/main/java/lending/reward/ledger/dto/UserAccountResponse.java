package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lending.reward.ledger.domain.UserAccount;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ledger view of a user")
public class UserAccountResponse {
    private Long userId;
    private Integer userLevel;
    private Integer levelMultiplierBps;
    private BigInteger balance;
    private BigInteger debt;

    @Schema(description = "Points held by the aggregate lock")
    private BigInteger lockedPoints;
    private Long lockedMaturity;

    @Schema(description = "Points held across live per-order locks")
    private BigInteger orderLockedPoints;

    private Long lastActivity;
    private Long totalLoanCount;
    private BigInteger totalVolume;
    private Long eligibleLoanCount;
    private Long onTimeRepayCount;

    public static UserAccountResponse fromAccount(UserAccount account, BigInteger balance,
                                                  BigInteger orderLockedPoints, Integer levelMultiplierBps) {
        return UserAccountResponse.builder()
                .userId(account.getUserId())
                .userLevel(account.getUserLevel())
                .levelMultiplierBps(levelMultiplierBps)
                .balance(balance)
                .debt(account.getDebt())
                .lockedPoints(account.getLockedPoints())
                .lockedMaturity(account.getLockedMaturity())
                .orderLockedPoints(orderLockedPoints)
                .lastActivity(account.getLastActivity())
                .totalLoanCount(account.getTotalLoanCount())
                .totalVolume(account.getTotalVolume())
                .eligibleLoanCount(account.getEligibleLoanCount())
                .onTimeRepayCount(account.getOnTimeRepayCount())
                .build();
    }
}
