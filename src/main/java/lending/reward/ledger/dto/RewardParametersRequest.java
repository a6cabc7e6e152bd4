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
@Schema(description = "Core reward formula parameters")
public class RewardParametersRequest {
    @NotNull(message = "baseUsd cannot be null")
    @Schema(description = "Base USD value, 18 decimals", example = "100000000000000000000")
    private BigInteger baseUsd;

    @NotNull(message = "perDay cannot be null")
    @Schema(example = "10")
    private Long perDay;

    @NotNull(message = "bonusBps cannot be null")
    @Schema(example = "500")
    private Integer bonusBps;

    @NotNull(message = "dynamicThreshold cannot be null")
    @Schema(description = "18 decimals", example = "1000000000000000000000")
    private BigInteger dynamicThreshold;
}
