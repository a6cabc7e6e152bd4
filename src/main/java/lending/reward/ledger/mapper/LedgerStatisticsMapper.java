package lending.reward.ledger.mapper;

import lending.reward.ledger.domain.LedgerStatistics;
import org.apache.ibatis.annotations.Mapper;

/**
 * MyBatis mapper for the single-row aggregate counters
 */
@Mapper
public interface LedgerStatisticsMapper {
    LedgerStatistics find();

    void insert(LedgerStatistics statistics);

    /**
     * Add every counter of the delta to the stored totals
     */
    void applyDelta(LedgerStatistics delta);
}
