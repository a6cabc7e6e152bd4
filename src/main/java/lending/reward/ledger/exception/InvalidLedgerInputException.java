package lending.reward.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown for malformed input: zero amounts, out-of-range levels, bad batch shape
 */
public class InvalidLedgerInputException extends BusinessException {
    public InvalidLedgerInputException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
