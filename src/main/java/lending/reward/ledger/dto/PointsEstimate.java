package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Formula-based reward preview, 18-decimal points")
public class PointsEstimate {

    private BigInteger basePoints;

    private BigInteger bonusPoints;

    private BigInteger totalPoints;

    @Schema(description = "Level multiplier applied, basis points; null for the plain formula")
    private Integer levelMultiplierBps;

    @Schema(description = "Whether the dynamic multiplier was applied")
    private Boolean dynamicApplied;

    public static PointsEstimate zero() {
        return PointsEstimate.builder()
                .basePoints(BigInteger.ZERO)
                .bonusPoints(BigInteger.ZERO)
                .totalPoints(BigInteger.ZERO)
                .dynamicApplied(false)
                .build();
    }
}
