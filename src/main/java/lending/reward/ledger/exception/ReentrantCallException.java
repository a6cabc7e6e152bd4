package lending.reward.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a thread already running a ledger mutation tries to start another
 */
public class ReentrantCallException extends BusinessException {
    public ReentrantCallException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
