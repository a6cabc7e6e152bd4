package lending.reward.ledger.service.lock;

import lending.reward.ledger.exception.LockAcquisitionException;
import lending.reward.ledger.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every ledger mutation behind one global lock.
 *
 * With a RedissonClient available the lock is a Redis RLock shared by all instances,
 * otherwise a fair in-process lock. A thread already inside a mutation may not start another.
 */
@Service
@Slf4j
public class LedgerLockService {

    @Autowired
    private ObjectProvider<RedissonClient> redissonClientProvider;

    @Value("${ledger.lock.key:lock:ledger:mutation}")
    private String lockKey;

    @Value("${ledger.lock.wait-time-ms:3000}")
    private long waitTimeMs;

    @Value("${ledger.lock.lease-time-ms:30000}")
    private long leaseTimeMs;

    private final ReentrantLock localLock = new ReentrantLock(true);

    private final ThreadLocal<String> activeOperation = new ThreadLocal<>();

    /**
     * Execute action while holding the ledger lock
     *
     * @param operation name of the mutation, for logs and the re-entry message
     * @param action the action to execute while holding the lock
     * @param <T> the return type of the action
     * @return the result of the action
     * @throws ReentrantCallException if the current thread is already inside a mutation
     * @throws LockAcquisitionException if lock cannot be acquired within wait time
     */
    public <T> T executeExclusive(String operation, Supplier<T> action) {
        String running = activeOperation.get();
        if (running != null) {
            log.warn("Rejected re-entrant ledger call: operation={}, running={}", operation, running);
            throw new ReentrantCallException(
                    "Ledger operation " + operation + " called while " + running + " is in progress");
        }

        RedissonClient redissonClient = redissonClientProvider.getIfAvailable();
        if (redissonClient != null) {
            return executeWithRedisLock(redissonClient.getLock(lockKey), operation, action);
        }
        return executeWithLocalLock(operation, action);
    }

    public boolean isInsideMutation() {
        return activeOperation.get() != null;
    }

    private <T> T executeWithRedisLock(RLock lock, String operation, Supplier<T> action) {
        try {
            boolean acquired = lock.tryLock(waitTimeMs, leaseTimeMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("Failed to acquire lock: {} after {}ms, operation={}", lockKey, waitTimeMs, operation);
                throw new LockAcquisitionException("Cannot acquire ledger lock for " + operation);
            }

            log.debug("Lock acquired: {}, operation={}", lockKey, operation);
            return runGuarded(operation, action);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while acquiring lock: {}", lockKey, e);
            throw new LockAcquisitionException("Interrupted while acquiring ledger lock for " + operation, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Lock released: {}", lockKey);
            }
        }
    }

    private <T> T executeWithLocalLock(String operation, Supplier<T> action) {
        try {
            boolean acquired = localLock.tryLock(waitTimeMs, TimeUnit.MILLISECONDS);
            if (!acquired) {
                log.warn("Failed to acquire local ledger lock after {}ms, operation={}", waitTimeMs, operation);
                throw new LockAcquisitionException("Cannot acquire ledger lock for " + operation);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while acquiring local ledger lock, operation={}", operation, e);
            throw new LockAcquisitionException("Interrupted while acquiring ledger lock for " + operation, e);
        }

        try {
            return runGuarded(operation, action);
        } finally {
            localLock.unlock();
        }
    }

    private <T> T runGuarded(String operation, Supplier<T> action) {
        activeOperation.set(operation);
        try {
            return action.get();
        } finally {
            activeOperation.remove();
        }
    }

    public String getLockConfig() {
        return String.format("LedgerLock[distributed=%s, key=%s, waitTime=%dms, leaseTime=%dms]",
                redissonClientProvider.getIfAvailable() != null, lockKey, waitTimeMs, leaseTimeMs);
    }
}
