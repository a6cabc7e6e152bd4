package lending.reward.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Batch purchase as parallel arrays; fails as a whole if any item fails")
public class BatchConsumeRequest {
    private List<Long> userIds;

    private List<ServiceType> serviceTypes;

    private List<ServiceLevel> serviceLevels;
}
