package lending.reward.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the ledger mutation lock cannot be acquired
 */
public class LockAcquisitionException extends BusinessException {

    public LockAcquisitionException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message, cause);
    }
}
