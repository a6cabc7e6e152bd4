package lending.reward.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a caller does not hold the capability for an entry point,
 * or repays an order it did not borrow
 */
public class UnauthorizedCallerException extends BusinessException {
    public UnauthorizedCallerException(String message) {
        super(HttpStatus.FORBIDDEN, message);
    }
}
