package lending.reward.ledger.enums;

/**
 * What a single accrual call did to the ledger
 */
public enum AccrualAction {
    LOCKED,
    RELEASED,
    FORFEITED,
    PENALIZED,
    NOT_ELIGIBLE,
    IGNORED
}
