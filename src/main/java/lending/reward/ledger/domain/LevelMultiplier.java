package lending.reward.ledger.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reward multiplier for a tier level, in basis points (10000 = 1.0x)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LevelMultiplier {
    private Integer tierLevel;

    private Integer multiplierBps;
}
