package lending.reward.ledger.service.balance;

import lending.reward.ledger.exception.InsufficientBalanceException;
import lending.reward.ledger.exception.UnauthorizedCallerException;

import java.math.BigInteger;

/**
 * Spendable points ledger. Only engine identities holding MINT_BURN may change balances.
 */
public interface PointsBalanceService {

    /**
     * Current balance, zero for an unknown user
     */
    BigInteger balanceOf(Long userId);

    /**
     * @throws UnauthorizedCallerException if minterId does not hold MINT_BURN
     */
    void mint(String minterId, Long userId, BigInteger amount);

    /**
     * @throws UnauthorizedCallerException if minterId does not hold MINT_BURN
     * @throws InsufficientBalanceException if the balance is below amount
     */
    void burn(String minterId, Long userId, BigInteger amount);
}
