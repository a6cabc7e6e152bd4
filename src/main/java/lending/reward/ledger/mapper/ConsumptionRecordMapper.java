package lending.reward.ledger.mapper;

import lending.reward.ledger.domain.ConsumptionRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper for the append-only consumption history
 */
@Mapper
public interface ConsumptionRecordMapper {
    /**
     * Insert a record, the generated ID is written back
     */
    void insert(ConsumptionRecord record);

    /**
     * Full history of a user in insertion order
     */
    List<ConsumptionRecord> findByUserId(@Param("userId") Long userId);

    /**
     * Records of a user that have not expired at the given time
     */
    List<ConsumptionRecord> findActiveByUserId(@Param("userId") Long userId, @Param("now") Long now);
}
