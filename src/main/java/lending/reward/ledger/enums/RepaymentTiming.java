package lending.reward.ledger.enums;

/**
 * Position of a repayment relative to the maturity window
 */
public enum RepaymentTiming {
    EARLY,
    ON_TIME,
    LATE;

    /**
     * Classify a repayment time against maturity plus or minus the window (inclusive bounds)
     */
    public static RepaymentTiming classify(long repaidAt, long maturity, long windowSeconds) {
        if (repaidAt < maturity - windowSeconds) {
            return EARLY;
        }
        if (repaidAt > maturity + windowSeconds) {
            return LATE;
        }
        return ON_TIME;
    }
}
