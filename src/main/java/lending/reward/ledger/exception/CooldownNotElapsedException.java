package lending.reward.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a service type is bought again before its cooldown has passed
 */
public class CooldownNotElapsedException extends BusinessException {

    private final long remainingSeconds;

    public CooldownNotElapsedException(String message, long remainingSeconds) {
        super(HttpStatus.CONFLICT, message);
        this.remainingSeconds = remainingSeconds;
    }

    public long getRemainingSeconds() {
        return remainingSeconds;
    }
}
