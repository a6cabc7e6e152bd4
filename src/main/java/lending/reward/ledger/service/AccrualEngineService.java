package lending.reward.ledger.service;

import lending.reward.ledger.domain.LedgerStatistics;
import lending.reward.ledger.domain.OrderLock;
import lending.reward.ledger.domain.RewardParameters;
import lending.reward.ledger.domain.UserAccount;
import lending.reward.ledger.dto.AccrualResult;
import lending.reward.ledger.enums.AccrualAction;
import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.enums.LoanOutcome;
import lending.reward.ledger.enums.RepaymentTiming;
import lending.reward.ledger.exception.InvalidLedgerInputException;
import lending.reward.ledger.exception.UnauthorizedCallerException;
import lending.reward.ledger.mapper.OrderLockMapper;
import lending.reward.ledger.service.auth.AuthorizationService;
import lending.reward.ledger.service.auth.CallerContext;
import lending.reward.ledger.service.balance.PointsBalanceService;
import lending.reward.ledger.service.lock.LedgerMutationExecutor;
import lending.reward.ledger.service.telemetry.TelemetryPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns loan lifecycle events into points.
 *
 * An eligible borrow locks one point until the repayment outcome is known. An on-time full
 * repayment releases the lock (debt is paid off first, the rest is minted). Any other outcome
 * forfeits the lock and charges a penalty of locked * bps / 10000, burned from the balance as
 * far as it goes, the shortfall becoming debt.
 *
 * Two event shapes are accepted: the per-order form ({@link #onLoanEventV2}) is authoritative;
 * the aggregate per-user form ({@link #onLoanEvent}) is kept for older lending engines that do
 * not send order ids.
 */
@Slf4j
@Service
public class AccrualEngineService {

    /**
     * Smallest principal that earns points: 1000 USDC in 6-decimal units
     */
    public static final BigInteger MIN_ELIGIBLE_PRINCIPAL = BigInteger.valueOf(1_000_000_000L);

    public static final BigInteger ONE_POINT = BigInteger.TEN.pow(18);

    public static final int MAX_BATCH_SIZE = 100;

    /**
     * Identity this engine uses against the points balance
     */
    public static final String ENGINE_ID = "accrual-engine";

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(RewardParameterService.BPS_DENOMINATOR);

    @Autowired
    private AuthorizationService authorizationService;

    @Autowired
    private LedgerMutationExecutor mutationExecutor;

    @Autowired
    private UserAccountService accountService;

    @Autowired
    private OrderLockMapper orderLockMapper;

    @Autowired
    private DebtLedgerService debtLedger;

    @Autowired
    private TierService tierService;

    @Autowired
    private RewardParameterService parameterService;

    @Autowired
    private PointsBalanceService pointsBalance;

    @Autowired
    private LedgerStatisticsService statisticsService;

    @Autowired
    private TelemetryPublisher telemetry;

    @Autowired
    private Clock clock;

    /**
     * Aggregate loan event: termSeconds &gt; 0 is a borrow, termSeconds == 0 a repayment
     */
    public AccrualResult onLoanEvent(CallerContext caller, Long userId, BigInteger principal,
                                     long termSeconds, boolean onTimeAndFull) {
        authorizationService.requireRole(LedgerAction.DELIVER_LOAN_EVENT, caller);
        validateLoanEvent(userId, principal, termSeconds);

        return mutationExecutor.execute("onLoanEvent",
                () -> applyLoanEvent(userId, principal, termSeconds, onTimeAndFull));
    }

    /**
     * Per-order loan event. Duplicate borrows and repayments of unknown or settled orders are no-ops.
     *
     * @param maturity loan maturity in epoch seconds, used on BORROW
     * @throws UnauthorizedCallerException if the order was borrowed by another user
     */
    public AccrualResult onLoanEventV2(CallerContext caller, Long userId, Long orderId, BigInteger principal,
                                       long maturity, LoanOutcome outcome) {
        authorizationService.requireRole(LedgerAction.DELIVER_LOAN_EVENT, caller);
        validateUser(userId);
        if (orderId == null || orderId < 0) {
            throw new InvalidLedgerInputException("orderId must not be negative: " + orderId);
        }
        if (principal == null || principal.signum() < 0) {
            throw new InvalidLedgerInputException("principal must not be negative: " + principal);
        }
        if (outcome == null) {
            throw new InvalidLedgerInputException("outcome is required");
        }

        return mutationExecutor.execute("onLoanEventV2",
                () -> applyOrderEvent(userId, orderId, principal, maturity, outcome));
    }

    /**
     * Aggregate events for many users in one atomic call. outcomes[i] is the on-time-and-full flag.
     */
    public List<AccrualResult> onBatchLoanEvents(CallerContext caller, List<Long> userIds, List<BigInteger> principals,
                                                 List<Long> termSeconds, List<Boolean> outcomes) {
        authorizationService.requireRole(LedgerAction.DELIVER_LOAN_EVENT, caller);
        int size = validateBatch(userIds, principals, termSeconds, outcomes);
        for (int i = 0; i < size; i++) {
            if (termSeconds.get(i) == null || outcomes.get(i) == null) {
                throw new InvalidLedgerInputException("Batch item " + i + " is incomplete");
            }
            validateLoanEvent(userIds.get(i), principals.get(i), termSeconds.get(i));
        }

        return mutationExecutor.execute("onBatchLoanEvents", () -> {
            List<AccrualResult> results = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                results.add(applyLoanEvent(userIds.get(i), principals.get(i), termSeconds.get(i), outcomes.get(i)));
            }

            statisticsService.record(LedgerStatistics.builder().totalBatchOperations(1L).build());
            LedgerStatistics totals = statisticsService.getStatistics();
            telemetry.statsUpdated(totals.getTotalBatchOperations(), totals.getTotalPointsMinted());

            log.info("Batch loan events processed: size={}", size);
            return results;
        });
    }

    /**
     * Out-of-band penalty, e.g. from liquidation. Burns what the balance covers, the rest becomes debt.
     */
    public AccrualResult deductPoints(CallerContext caller, Long userId, BigInteger amount) {
        authorizationService.requireRole(LedgerAction.APPLY_PENALTY, caller);
        validateUser(userId);
        if (amount == null || amount.signum() <= 0) {
            throw new InvalidLedgerInputException("Penalty amount must be positive: " + amount);
        }

        return mutationExecutor.execute("deductPoints", () -> {
            UserAccount account = accountService.loadOrCreate(userId);
            account.setLastActivity(now());

            AccrualResult result = AccrualResult.of(userId, null, AccrualAction.PENALIZED);
            chargePenalty(account, amount, result, "penalty");
            accountService.save(account);

            log.info("Penalty applied: userId={}, amount={}, burned={}, debtAdded={}, caller={}",
                    userId, amount, result.getBurnedPoints(), result.getDebtAdded(), caller.getCallerId());
            result.setUserLevel(account.getUserLevel());
            return result;
        });
    }

    /**
     * Lock held for an order, or null if none is live
     */
    public OrderLock getOrderLock(Long orderId) {
        return orderLockMapper.findByOrderId(orderId);
    }

    public List<OrderLock> getOrderLocks(Long userId) {
        return orderLockMapper.findByBorrower(userId);
    }

    // ============= EVENT APPLICATION (runs inside a mutation) =============

    private AccrualResult applyLoanEvent(Long userId, BigInteger principal, long termSeconds, boolean onTimeAndFull) {
        long now = now();
        UserAccount account = accountService.loadOrCreate(userId);
        account.setLastActivity(now);

        AccrualResult result;
        if (termSeconds > 0) {
            recordBorrow(account, principal);
            if (!isEligible(principal)) {
                log.debug("Borrow below eligibility threshold: userId={}, principal={}", userId, principal);
                result = AccrualResult.of(userId, null, AccrualAction.NOT_ELIGIBLE);
            } else {
                account.setEligibleLoanCount(account.getEligibleLoanCount() + 1);
                account.setLockedPoints(account.getLockedPoints().add(ONE_POINT));
                account.setLockedMaturity(now + termSeconds);

                result = AccrualResult.of(userId, null, AccrualAction.LOCKED);
                result.setLockedPoints(ONE_POINT);
                log.info("Points locked: userId={}, principal={}, maturity={}, locked={}",
                        userId, principal, account.getLockedMaturity(), account.getLockedPoints());
                telemetry.pointsLocked(userId, ONE_POINT, null);
            }
        } else if (!account.hasAggregateLock()) {
            log.debug("Repayment without a live lock: userId={}", userId);
            result = AccrualResult.of(userId, null, AccrualAction.IGNORED);
        } else {
            BigInteger locked = account.getLockedPoints();
            long maturity = account.getLockedMaturity();
            account.setLockedPoints(BigInteger.ZERO);
            account.setLockedMaturity(0L);

            if (onTimeAndFull) {
                account.setOnTimeRepayCount(account.getOnTimeRepayCount() + 1);
                result = release(account, null, locked);
            } else {
                RewardParameters parameters = parameterService.getParameters();
                RepaymentTiming timing = RepaymentTiming.classify(now, maturity, parameters.getOnTimeWindowSeconds());
                // a not-full repayment inside the window is charged as late
                int bps = timing == RepaymentTiming.EARLY
                        ? parameters.getEarlyPenaltyBps()
                        : parameters.getLatePenaltyBps();
                result = forfeit(account, null, locked, bps, timing);
            }
        }

        tierService.evaluatePromotion(account);
        accountService.save(account);
        result.setUserLevel(account.getUserLevel());
        return result;
    }

    private AccrualResult applyOrderEvent(Long userId, Long orderId, BigInteger principal, long maturity,
                                          LoanOutcome outcome) {
        if (!outcome.isRepayment()) {
            return applyOrderBorrow(userId, orderId, principal, maturity);
        }

        OrderLock lock = orderLockMapper.findByOrderId(orderId);
        if (lock == null) {
            log.debug("Repayment for unknown or settled order ignored: userId={}, orderId={}, outcome={}",
                    userId, orderId, outcome);
            return AccrualResult.of(userId, orderId, AccrualAction.IGNORED);
        }
        if (!lock.getBorrower().equals(userId)) {
            log.warn("Order repayment from wrong user: orderId={}, borrower={}, userId={}",
                    orderId, lock.getBorrower(), userId);
            throw new UnauthorizedCallerException("Order " + orderId + " was not borrowed by user " + userId);
        }

        orderLockMapper.deleteByOrderId(orderId);
        UserAccount account = accountService.loadOrCreate(userId);
        account.setLastActivity(now());

        AccrualResult result;
        RewardParameters parameters = parameterService.getParameters();
        switch (outcome) {
            case REPAY_ON_TIME_FULL:
                account.setOnTimeRepayCount(account.getOnTimeRepayCount() + 1);
                result = release(account, orderId, lock.getLockedPoints());
                break;
            case REPAY_EARLY_FULL:
                result = forfeit(account, orderId, lock.getLockedPoints(), parameters.getEarlyPenaltyBps(),
                        RepaymentTiming.EARLY);
                break;
            case REPAY_LATE_FULL:
                result = forfeit(account, orderId, lock.getLockedPoints(), parameters.getLatePenaltyBps(),
                        RepaymentTiming.LATE);
                break;
            default:
                throw new InvalidLedgerInputException("Unsupported outcome: " + outcome);
        }

        tierService.evaluatePromotion(account);
        accountService.save(account);
        result.setUserLevel(account.getUserLevel());
        return result;
    }

    private AccrualResult applyOrderBorrow(Long userId, Long orderId, BigInteger principal, long maturity) {
        if (isEligible(principal) && orderLockMapper.findByOrderId(orderId) != null) {
            log.debug("Duplicate borrow ignored: userId={}, orderId={}", userId, orderId);
            return AccrualResult.of(userId, orderId, AccrualAction.IGNORED);
        }

        UserAccount account = accountService.loadOrCreate(userId);
        account.setLastActivity(now());
        recordBorrow(account, principal);

        AccrualResult result;
        if (!isEligible(principal)) {
            log.debug("Borrow below eligibility threshold: userId={}, orderId={}, principal={}",
                    userId, orderId, principal);
            result = AccrualResult.of(userId, orderId, AccrualAction.NOT_ELIGIBLE);
        } else {
            orderLockMapper.insert(OrderLock.builder()
                    .orderId(orderId)
                    .borrower(userId)
                    .lockedPoints(ONE_POINT)
                    .maturity(maturity)
                    .build());
            account.setEligibleLoanCount(account.getEligibleLoanCount() + 1);

            result = AccrualResult.of(userId, orderId, AccrualAction.LOCKED);
            result.setLockedPoints(ONE_POINT);
            log.info("Order points locked: userId={}, orderId={}, principal={}, maturity={}",
                    userId, orderId, principal, maturity);
            telemetry.pointsLocked(userId, ONE_POINT, "order:" + orderId);
        }

        tierService.evaluatePromotion(account);
        accountService.save(account);
        result.setUserLevel(account.getUserLevel());
        return result;
    }

    // ============= RELEASE / FORFEIT =============

    private AccrualResult release(UserAccount account, Long orderId, BigInteger locked) {
        Long userId = account.getUserId();
        BigInteger mintable = debtLedger.offsetRelease(account, locked);
        if (mintable.signum() > 0) {
            pointsBalance.mint(ENGINE_ID, userId, mintable);
            telemetry.rewardEarned(userId, mintable, orderId == null ? null : "order:" + orderId);
        }
        statisticsService.record(LedgerStatistics.builder().totalPointsMinted(mintable).build());

        log.info("Points released: userId={}, orderId={}, locked={}, minted={}, debt={}",
                userId, orderId, locked, mintable, account.getDebt());

        AccrualResult result = AccrualResult.of(userId, orderId, AccrualAction.RELEASED);
        result.setMintedPoints(mintable);
        return result;
    }

    private AccrualResult forfeit(UserAccount account, Long orderId, BigInteger locked, int penaltyBps,
                                  RepaymentTiming timing) {
        BigInteger penalty = locked.multiply(BigInteger.valueOf(penaltyBps)).divide(BPS_DENOMINATOR);
        AccrualResult result = AccrualResult.of(account.getUserId(), orderId, AccrualAction.FORFEITED);
        if (penalty.signum() > 0) {
            chargePenalty(account, penalty, result, orderId == null ? timing.name() : "order:" + orderId);
        }
        statisticsService.record(LedgerStatistics.builder().totalPointsForfeited(locked).build());

        log.info("Points forfeited: userId={}, orderId={}, timing={}, locked={}, penaltyBps={}, burned={}, debtAdded={}",
                account.getUserId(), orderId, timing, locked, penaltyBps, result.getBurnedPoints(),
                result.getDebtAdded());
        return result;
    }

    /**
     * Burn min(balance, penalty) and move the shortfall to debt
     */
    private void chargePenalty(UserAccount account, BigInteger penalty, AccrualResult result, String detail) {
        Long userId = account.getUserId();
        BigInteger burnable = pointsBalance.balanceOf(userId).min(penalty);
        if (burnable.signum() > 0) {
            pointsBalance.burn(ENGINE_ID, userId, burnable);
            telemetry.pointsBurned(userId, burnable, detail);
        }

        BigInteger shortfall = penalty.subtract(burnable);
        debtLedger.recordShortfall(account, shortfall);

        statisticsService.record(LedgerStatistics.builder()
                .totalPointsBurned(burnable)
                .totalDebtRecorded(shortfall)
                .build());
        result.setBurnedPoints(burnable);
        result.setDebtAdded(shortfall);
    }

    // ============= HELPERS =============

    private static void recordBorrow(UserAccount account, BigInteger principal) {
        account.setTotalLoanCount(account.getTotalLoanCount() + 1);
        account.setTotalVolume(account.getTotalVolume().add(principal));
    }

    public static boolean isEligible(BigInteger principal) {
        return principal.compareTo(MIN_ELIGIBLE_PRINCIPAL) >= 0;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static void validateUser(Long userId) {
        UserAccountService.requireUserId(userId);
    }

    private static void validateLoanEvent(Long userId, BigInteger principal, long termSeconds) {
        validateUser(userId);
        if (principal == null || principal.signum() < 0) {
            throw new InvalidLedgerInputException("principal must not be negative: " + principal);
        }
        if (termSeconds < 0) {
            throw new InvalidLedgerInputException("termSeconds must not be negative: " + termSeconds);
        }
    }

    private static int validateBatch(List<?>... columns) {
        int size = columns[0] == null ? 0 : columns[0].size();
        if (size == 0) {
            throw new InvalidLedgerInputException("Batch must not be empty");
        }
        for (List<?> column : columns) {
            if (column == null || column.size() != size) {
                throw new InvalidLedgerInputException("Batch arrays must have equal length");
            }
        }
        if (size > MAX_BATCH_SIZE) {
            throw new InvalidLedgerInputException("Batch size " + size + " exceeds limit " + MAX_BATCH_SIZE);
        }
        return size;
    }
}
