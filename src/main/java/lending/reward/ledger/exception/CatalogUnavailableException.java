package lending.reward.ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the service catalog cannot resolve a service type
 */
public class CatalogUnavailableException extends BusinessException {
    public CatalogUnavailableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, message);
    }
}
