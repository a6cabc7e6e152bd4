package lending.reward.ledger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Points locked against a single loan order until its repayment outcome arrives
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLock {
    /**
     * Loan order ID (primary key, 0 is a valid id)
     */
    private Long orderId;

    /**
     * User who borrowed; repayments from anyone else are rejected
     */
    private Long borrower;

    private BigInteger lockedPoints;

    /**
     * Loan maturity in epoch seconds
     */
    private Long maturity;

    private LocalDateTime createdAt;
}
