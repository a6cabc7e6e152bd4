package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lending.reward.ledger.enums.LoanOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-order loan lifecycle event")
public class OrderLoanEventRequest {
    @NotNull(message = "User ID cannot be null")
    @Positive(message = "User ID must be positive")
    @Schema(description = "User ID", example = "1")
    private Long userId;

    @NotNull(message = "Order ID cannot be null")
    @PositiveOrZero(message = "Order ID must not be negative")
    @Schema(description = "Loan order ID", example = "42")
    private Long orderId;

    @NotNull(message = "Principal cannot be null")
    @PositiveOrZero(message = "Principal must not be negative")
    @Schema(description = "Principal in 6-decimal stable units", example = "2000000000")
    private BigInteger principal;

    @Schema(description = "Maturity in epoch seconds, used on BORROW", example = "1767225600")
    private long maturity;

    @NotNull(message = "Outcome cannot be null")
    @Schema(description = "Lifecycle outcome", example = "BORROW")
    private LoanOutcome outcome;
}
