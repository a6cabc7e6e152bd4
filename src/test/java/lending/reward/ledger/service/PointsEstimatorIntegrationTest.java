package lending.reward.ledger.service;

import lending.reward.ledger.BaseIntegrationTest;
import lending.reward.ledger.dto.PointsEstimate;
import lending.reward.ledger.exception.InvalidLedgerInputException;
import lending.reward.ledger.exception.UnauthorizedCallerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Per-user estimates: level and dynamic multipliers plus the estimate cache
 */
@DisplayName("Points Estimator Integration Tests")
class PointsEstimatorIntegrationTest extends BaseIntegrationTest {

    private static final Long USER = 401L;

    @Autowired
    private PointsEstimatorService estimatorService;

    @Autowired
    private TierService tierService;

    @Autowired
    private RewardParameterService parameterService;

    @AfterEach
    void clearCache() {
        estimatorService.clearUserCache(ADMIN, USER);
    }

    @Test
    @DisplayName("Level multiplier scales the per-user estimate")
    void testLevelMultiplier() {
        // GIVEN: User overridden to level 3 (x1.25)
        tierService.updateUserLevel(ADMIN, USER, 3);

        // WHEN: 1000 USDC for 30 days
        PointsEstimate estimate = estimatorService.estimateUserPoints(USER, usdc(1000), 30 * ONE_DAY, false);

        // THEN: 518400000000000 * 1.25
        assertThat(estimate.getLevelMultiplierBps()).isEqualTo(12_500);
        assertThat(estimate.getTotalPoints()).isEqualTo(new BigInteger("648000000000000"));
        assertThat(estimate.getDynamicApplied()).isFalse();
    }

    @Test
    @DisplayName("Dynamic multiplier applies once the total reaches the threshold")
    void testDynamicMultiplier() {
        parameterService.setDynamicRewardParameters(ADMIN, new BigInteger("500000000000000"), 12_000);

        PointsEstimate estimate = estimatorService.estimateUserPoints(USER, usdc(1000), 30 * ONE_DAY, false);

        assertThat(estimate.getDynamicApplied()).isTrue();
        assertThat(estimate.getTotalPoints()).isEqualTo(new BigInteger("622080000000000"));
    }

    @Test
    @DisplayName("Estimates are cached until cleared")
    void testCache() {
        PointsEstimate first = estimatorService.estimateUserPoints(USER, usdc(1000), 30 * ONE_DAY, false);
        tierService.updateUserLevel(ADMIN, USER, 5);

        PointsEstimate cached = estimatorService.estimateUserPoints(USER, usdc(1000), 30 * ONE_DAY, false);
        assertThat(cached.getTotalPoints()).isEqualTo(first.getTotalPoints());
        assertThat(estimatorService.getCachedEstimateCount()).isGreaterThanOrEqualTo(1L);

        estimatorService.clearUserCache(ADMIN, USER);
        PointsEstimate fresh = estimatorService.estimateUserPoints(USER, usdc(1000), 30 * ONE_DAY, false);

        assertThat(fresh.getTotalPoints()).isEqualTo(first.getTotalPoints().multiply(BigInteger.TWO));
    }

    @Test
    @DisplayName("Clearing the cache requires the parameter role")
    void testClearCache_RequiresRole() {
        assertThatThrownBy(() -> estimatorService.clearUserCache(STRANGER, USER))
                .isInstanceOf(UnauthorizedCallerException.class);
    }

    @Test
    @DisplayName("Negative inputs are rejected")
    void testNegativeInputs() {
        assertThatThrownBy(() -> estimatorService.calculateExamplePoints(BigInteger.valueOf(-1), ONE_DAY, false))
                .isInstanceOf(InvalidLedgerInputException.class);
        assertThatThrownBy(() -> estimatorService.calculateExamplePoints(usdc(1), -1, false))
                .isInstanceOf(InvalidLedgerInputException.class);
    }
}
