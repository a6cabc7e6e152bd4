package lending.reward.ledger.service.auth;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Identity of the component invoking a ledger entry point
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CallerContext {

    private final String callerId;

    private CallerContext(String callerId) {
        this.callerId = callerId;
    }

    public static CallerContext of(String callerId) {
        return new CallerContext(callerId);
    }
}
