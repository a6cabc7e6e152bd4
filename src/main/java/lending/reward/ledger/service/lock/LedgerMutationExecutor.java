package lending.reward.ledger.service.lock;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a ledger mutation under the global lock inside one database transaction.
 * Any exception rolls back every write of the mutation, balance changes included.
 */
@Component
public class LedgerMutationExecutor {

    @Autowired
    private LedgerLockService lockService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    public <T> T execute(String operation, Supplier<T> action) {
        return lockService.executeExclusive(operation,
                () -> transactionTemplate.execute(status -> action.get()));
    }
}
