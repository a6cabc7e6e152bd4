package lending.reward.ledger.service;

import lending.reward.ledger.domain.UserAccount;
import lending.reward.ledger.service.telemetry.TelemetryPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Penalty debt owed by a user when a burn could not be covered.
 * Debt is repaid first out of any future release.
 *
 * Mutating methods work on the account loaded by the running mutation; the caller persists it.
 */
@Slf4j
@Service
public class DebtLedgerService {

    @Autowired
    private UserAccountService accountService;

    @Autowired
    private TelemetryPublisher telemetry;

    /**
     * Add an unpaid penalty to the user's debt
     */
    public void recordShortfall(UserAccount account, BigInteger amount) {
        if (amount.signum() <= 0) {
            return;
        }
        BigInteger debt = account.getDebt().add(amount);
        account.setDebt(debt);
        log.info("Penalty shortfall recorded: userId={}, shortfall={}, debt={}", account.getUserId(), amount, debt);
        telemetry.debtChanged(account.getUserId(), debt);
    }

    /**
     * Offset a release against outstanding debt
     *
     * @return the part of the release left to mint
     */
    public BigInteger offsetRelease(UserAccount account, BigInteger releaseAmount) {
        BigInteger debt = account.getDebt();
        if (debt.signum() == 0) {
            return releaseAmount;
        }

        BigInteger offset = debt.min(releaseAmount);
        BigInteger remainingDebt = debt.subtract(offset);
        account.setDebt(remainingDebt);
        log.info("Release offset against debt: userId={}, release={}, offset={}, debt={}",
                account.getUserId(), releaseAmount, offset, remainingDebt);
        telemetry.debtChanged(account.getUserId(), remainingDebt);
        return releaseAmount.subtract(offset);
    }

    public BigInteger getPenaltyDebt(Long userId) {
        return accountService.getAccount(userId).getDebt();
    }
}
