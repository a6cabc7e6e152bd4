package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

/**
 * Parallel arrays, item i is (userIds[i], principals[i], termSeconds[i], outcomes[i])
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Batch of aggregate loan events, at most 100 items")
public class BatchLoanEventRequest {
    private List<Long> userIds;

    private List<BigInteger> principals;

    private List<Long> termSeconds;

    @Schema(description = "On-time-and-full flag per item")
    private List<Boolean> outcomes;
}
