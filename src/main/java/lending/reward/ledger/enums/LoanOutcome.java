package lending.reward.ledger.enums;

/**
 * Lifecycle event delivered for a single loan order
 */
public enum LoanOutcome {
    /**
     * Loan originated, points are locked until the outcome is known
     */
    BORROW,

    /**
     * Repaid in full inside the on-time window
     */
    REPAY_ON_TIME_FULL,

    /**
     * Repaid in full before the on-time window opened
     */
    REPAY_EARLY_FULL,

    /**
     * Repaid in full after the on-time window closed
     */
    REPAY_LATE_FULL;

    public boolean isRepayment() {
        return this != BORROW;
    }
}
