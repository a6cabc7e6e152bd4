package lending.reward.ledger.service.auth;

import lending.reward.ledger.config.AuthorizationProperties;
import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.exception.UnauthorizedCallerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Authorization backed by the static role table in ledger.auth.roles
 */
@Slf4j
@Service
public class ConfiguredAuthorizationService implements AuthorizationService {

    @Autowired
    private AuthorizationProperties properties;

    @Override
    public boolean hasRole(LedgerAction action, CallerContext caller) {
        if (caller == null || caller.getCallerId() == null) {
            return false;
        }
        Set<String> holders = properties.getRoles().get(action);
        return holders != null && holders.contains(caller.getCallerId());
    }

    @Override
    public void requireRole(LedgerAction action, CallerContext caller) {
        if (!hasRole(action, caller)) {
            String callerId = caller == null ? null : caller.getCallerId();
            log.warn("Rejected caller: action={}, callerId={}", action, callerId);
            throw new UnauthorizedCallerException("Caller " + callerId + " is not allowed to " + action);
        }
    }
}
