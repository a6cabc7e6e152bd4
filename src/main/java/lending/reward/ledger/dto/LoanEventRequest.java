package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Aggregate loan event: a positive term is a borrow, zero a repayment")
public class LoanEventRequest {
    @NotNull(message = "User ID cannot be null")
    @Positive(message = "User ID must be positive")
    @Schema(description = "User ID", example = "1")
    private Long userId;

    @NotNull(message = "Principal cannot be null")
    @PositiveOrZero(message = "Principal must not be negative")
    @Schema(description = "Principal in 6-decimal stable units", example = "2000000000")
    private BigInteger principal;

    @NotNull(message = "Term cannot be null")
    @PositiveOrZero(message = "Term must not be negative")
    @Schema(description = "Loan term in seconds, 0 for a repayment", example = "2592000")
    private Long termSeconds;

    @Schema(description = "Repayment was on time and in full", example = "true")
    private boolean onTimeAndFull;
}
