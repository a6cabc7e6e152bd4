package lending.reward.ledger.service;

import lending.reward.ledger.domain.UserAccount;
import lending.reward.ledger.exception.InvalidLedgerInputException;
import lending.reward.ledger.mapper.OrderLockMapper;
import lending.reward.ledger.mapper.UserAccountMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

/**
 * Keyed store of user accounts. Writes happen only from inside a ledger mutation.
 */
@Slf4j
@Service
public class UserAccountService {

    @Autowired
    private UserAccountMapper accountMapper;

    @Autowired
    private OrderLockMapper orderLockMapper;

    public static void requireUserId(Long userId) {
        if (userId == null || userId <= 0) {
            throw new InvalidLedgerInputException("userId must be positive: " + userId);
        }
    }

    /**
     * Load an account, creating a level-1 account on first contact
     */
    public UserAccount loadOrCreate(Long userId) {
        UserAccount account = accountMapper.findByUserId(userId);
        if (account == null) {
            account = UserAccount.newAccount(userId);
            accountMapper.insert(account);
            log.info("Created user account: userId={}", userId);
        }
        return account;
    }

    public void save(UserAccount account) {
        accountMapper.update(account);
    }

    /**
     * Read-only lookup, a user with no ledger history gets a transient default account
     */
    public UserAccount getAccount(Long userId) {
        UserAccount account = accountMapper.findByUserId(userId);
        return account != null ? account : UserAccount.newAccount(userId);
    }

    /**
     * Points held in per-order locks for a user
     */
    public BigInteger getOrderLockedPoints(Long userId) {
        BigInteger locked = orderLockMapper.sumLockedByBorrower(userId);
        return locked == null ? BigInteger.ZERO : locked;
    }
}
