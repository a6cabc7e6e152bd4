package lending.reward.ledger.domain;

import lending.reward.ledger.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last purchase time per (user, service type)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceCooldown {
    private Long userId;

    private ServiceType serviceType;

    private Long lastConsumedAt;
}
