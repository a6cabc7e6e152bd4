package lending.reward.ledger.enums;

/**
 * Capabilities checked by the authorization service before a mutation
 */
public enum LedgerAction {
    /**
     * Deliver loan lifecycle events (the lending engine)
     */
    DELIVER_LOAN_EVENT,

    /**
     * Deduct points out of band (risk / liquidation subsystem)
     */
    APPLY_PENALTY,

    /**
     * Spend points on catalog services (consumption front door)
     */
    CONSUME_SERVICE,

    /**
     * Change administrative parameters and user levels
     */
    SET_PARAMETER,

    /**
     * Invoke the mint and burn primitives of the points balance
     */
    MINT_BURN
}
