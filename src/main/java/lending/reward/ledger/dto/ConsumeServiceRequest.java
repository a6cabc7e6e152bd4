package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Purchase request, also used for upgrades where serviceLevel is the target level
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Service purchase or upgrade")
public class ConsumeServiceRequest {
    @NotNull(message = "User ID cannot be null")
    @Positive(message = "User ID must be positive")
    @Schema(description = "User ID", example = "1")
    private Long userId;

    @NotNull(message = "Service type cannot be null")
    @Schema(description = "Service type", example = "ADVANCED_ANALYTICS")
    private ServiceType serviceType;

    @NotNull(message = "Service level cannot be null")
    @Schema(description = "Service level", example = "BASIC")
    private ServiceLevel serviceLevel;
}
