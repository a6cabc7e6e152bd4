package lending.reward.ledger.exception;

import org.springframework.http.HttpStatus;

public class ServiceInactiveException extends BusinessException {
    public ServiceInactiveException(String message) {
        super(HttpStatus.CONFLICT, message);
    }
}
