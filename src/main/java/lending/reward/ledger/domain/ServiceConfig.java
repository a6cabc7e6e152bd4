package lending.reward.ledger.domain;

import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Catalog entry for one (service type, level) pair
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceConfig {
    private ServiceType serviceType;

    private ServiceLevel serviceLevel;

    /**
     * Price in points (18 decimals)
     */
    private BigInteger price;

    /**
     * How long a purchase grants access, in seconds
     */
    private Long durationSeconds;

    @Builder.Default
    private boolean active = true;

    private String description;
}
