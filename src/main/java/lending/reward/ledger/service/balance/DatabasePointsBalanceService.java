package lending.reward.ledger.service.balance;

import lending.reward.ledger.domain.PointsBalance;
import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.exception.InsufficientBalanceException;
import lending.reward.ledger.exception.InvalidLedgerInputException;
import lending.reward.ledger.mapper.PointsBalanceMapper;
import lending.reward.ledger.service.auth.AuthorizationService;
import lending.reward.ledger.service.auth.CallerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Points balance stored in the points_balance table.
 * Joins the caller's transaction, so a rolled back ledger mutation also rolls back its mint or burn.
 */
@Slf4j
@Service
public class DatabasePointsBalanceService implements PointsBalanceService {

    @Autowired
    private PointsBalanceMapper balanceMapper;

    @Autowired
    private AuthorizationService authorizationService;

    @Override
    public BigInteger balanceOf(Long userId) {
        PointsBalance balance = balanceMapper.findByUserId(userId);
        return balance == null ? BigInteger.ZERO : balance.getBalance();
    }

    @Override
    public void mint(String minterId, Long userId, BigInteger amount) {
        authorizationService.requireRole(LedgerAction.MINT_BURN, CallerContext.of(minterId));
        requirePositive(amount);

        PointsBalance balance = balanceMapper.findByUserId(userId);
        if (balance == null) {
            balance = PointsBalance.builder()
                    .userId(userId)
                    .balance(amount)
                    .build();
            balanceMapper.insert(balance);
            log.info("Created points balance: userId={}, balance={}", userId, amount);
            return;
        }

        BigInteger updated = balance.getBalance().add(amount);
        balanceMapper.updateBalance(userId, updated);
        log.info("Minted points: userId={}, amount={}, newBalance={}, minter={}", userId, amount, updated, minterId);
    }

    @Override
    public void burn(String minterId, Long userId, BigInteger amount) {
        authorizationService.requireRole(LedgerAction.MINT_BURN, CallerContext.of(minterId));
        requirePositive(amount);

        BigInteger current = balanceOf(userId);
        if (current.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(
                "Insufficient points: userId=" + userId +
                ", available=" + current +
                ", required=" + amount
            );
        }

        BigInteger updated = current.subtract(amount);
        balanceMapper.updateBalance(userId, updated);
        log.info("Burned points: userId={}, amount={}, newBalance={}, minter={}", userId, amount, updated, minterId);
    }

    private void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidLedgerInputException("Point amount must be positive: " + amount);
        }
    }
}
