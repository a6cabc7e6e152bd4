package lending.reward.ledger.controller;

/**
 * Request headers shared by the ledger endpoints
 */
public final class CallerHeaders {

    /**
     * Identity of the calling component, checked against ledger.auth.roles
     */
    public static final String CALLER_ID = "X-Caller-Id";

    private CallerHeaders() {
    }
}
