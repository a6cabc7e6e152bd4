package lending.reward.ledger.service;

import lending.reward.ledger.domain.LedgerStatistics;
import lending.reward.ledger.mapper.LedgerStatisticsMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Aggregate ledger counters
 */
@Service
public class LedgerStatisticsService {

    @Autowired
    private LedgerStatisticsMapper statisticsMapper;

    @Autowired
    private PointsEstimatorService estimatorService;

    /**
     * Add a delta to the stored totals. Must run inside a ledger mutation.
     */
    public void record(LedgerStatistics delta) {
        if (statisticsMapper.find() == null) {
            statisticsMapper.insert(LedgerStatistics.builder().build());
        }
        statisticsMapper.applyDelta(delta);
    }

    public LedgerStatistics getStatistics() {
        LedgerStatistics stored = statisticsMapper.find();
        LedgerStatistics statistics = stored != null ? stored : LedgerStatistics.builder().build();
        statistics.setTotalCachedRewards(estimatorService.getCachedEstimateCount());
        return statistics;
    }
}
