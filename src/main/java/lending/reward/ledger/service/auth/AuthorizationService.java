package lending.reward.ledger.service.auth;

import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.exception.UnauthorizedCallerException;

/**
 * Role check performed before any ledger mutation
 */
public interface AuthorizationService {

    boolean hasRole(LedgerAction action, CallerContext caller);

    /**
     * @throws UnauthorizedCallerException if the caller does not hold the action
     */
    void requireRole(LedgerAction action, CallerContext caller);
}
