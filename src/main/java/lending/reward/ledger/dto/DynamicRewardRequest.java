package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DynamicRewardRequest {
    @NotNull(message = "threshold cannot be null")
    @Schema(description = "Estimated total above which the multiplier applies, 18 decimals")
    private BigInteger threshold;

    @NotNull(message = "multiplierBps cannot be null")
    @Schema(example = "12000")
    private Integer multiplierBps;
}
