package lending.reward.ledger.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigInteger;

/**
 * Minimum lifetime activity required to hold a tier level
 */
@Getter
@AllArgsConstructor
public class TierThreshold {
    private final int level;

    /**
     * Lifetime principal in 6-decimal units
     */
    private final BigInteger minVolume;

    private final long minEligibleLoans;

    private final long minOnTimeRepays;

    public boolean isSatisfiedBy(UserAccount account) {
        return account.getTotalVolume().compareTo(minVolume) >= 0
                && account.getEligibleLoanCount() >= minEligibleLoans
                && account.getOnTimeRepayCount() >= minOnTimeRepays;
    }
}
