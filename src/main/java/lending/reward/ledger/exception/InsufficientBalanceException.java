package lending.reward.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when a user has insufficient points for a purchase
 */
public class InsufficientBalanceException extends BusinessException {
    public InsufficientBalanceException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
