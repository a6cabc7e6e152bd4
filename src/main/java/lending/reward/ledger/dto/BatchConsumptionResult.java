package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lending.reward.ledger.domain.ConsumptionRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Records created by a batch purchase and the points they burned")
public class BatchConsumptionResult {

    private List<ConsumptionRecord> records;

    private BigInteger totalPoints;
}
