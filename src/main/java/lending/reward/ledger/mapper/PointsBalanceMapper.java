package lending.reward.ledger.mapper;

import lending.reward.ledger.domain.PointsBalance;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.math.BigInteger;

/**
 * MyBatis mapper for PointsBalance operations
 */
@Mapper
public interface PointsBalanceMapper {
    /**
     * Insert a new balance record
     */
    void insert(PointsBalance balance);

    /**
     * Find balance by user ID
     */
    PointsBalance findByUserId(@Param("userId") Long userId);

    /**
     * Overwrite the balance of a user
     */
    void updateBalance(@Param("userId") Long userId, @Param("balance") BigInteger balance);
}
