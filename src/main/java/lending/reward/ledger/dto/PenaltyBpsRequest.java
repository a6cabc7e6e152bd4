package lending.reward.ledger.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PenaltyBpsRequest {
    @NotNull(message = "earlyBps cannot be null")
    private Integer earlyBps;

    @NotNull(message = "lateBps cannot be null")
    private Integer lateBps;
}
