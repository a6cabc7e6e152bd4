package lending.reward.ledger.mapper;

import lending.reward.ledger.domain.RewardParameters;
import org.apache.ibatis.annotations.Mapper;

/**
 * MyBatis mapper for the single-row reward parameter table
 */
@Mapper
public interface RewardParametersMapper {
    /**
     * Stored parameters, or null when never written
     */
    RewardParameters find();

    void insert(RewardParameters parameters);

    void update(RewardParameters parameters);
}
