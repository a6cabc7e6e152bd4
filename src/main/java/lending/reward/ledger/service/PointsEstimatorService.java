package lending.reward.ledger.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import jakarta.annotation.PostConstruct;
import lending.reward.ledger.domain.RewardParameters;
import lending.reward.ledger.dto.PointsEstimate;
import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.exception.InvalidLedgerInputException;
import lending.reward.ledger.service.auth.AuthorizationService;
import lending.reward.ledger.service.auth.CallerContext;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

/**
 * Read-only preview of the reward a loan would earn under the current parameters.
 *
 * base = principal / 100 * duration / 5 * baseUsd / 1e18, plus bonusBps of that when the
 * position is healthy. Per-user estimates also apply the level multiplier and, above the dynamic
 * threshold, the dynamic multiplier. They are cached for the administrative cache expiry.
 */
@Slf4j
@Service
public class PointsEstimatorService {

    private static final BigInteger HUNDRED = BigInteger.valueOf(100);
    private static final BigInteger FIVE = BigInteger.valueOf(5);
    private static final BigInteger WAD = BigInteger.TEN.pow(18);
    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(RewardParameterService.BPS_DENOMINATOR);

    @Autowired
    private RewardParameterService parameterService;

    @Autowired
    private UserAccountService accountService;

    @Autowired
    private AuthorizationService authorizationService;

    private Cache<EstimateKey, PointsEstimate> estimateCache;

    /**
     * Entry lifetime follows the current cache expiry parameter
     */
    @PostConstruct
    public void initializeCache() {
        estimateCache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfter(new Expiry<EstimateKey, PointsEstimate>() {
                    @Override
                    public long expireAfterCreate(EstimateKey key, PointsEstimate value, long currentTime) {
                        return TimeUnit.SECONDS.toNanos(parameterService.getParameters().getCacheExpirySeconds());
                    }

                    @Override
                    public long expireAfterUpdate(EstimateKey key, PointsEstimate value, long currentTime,
                                                  long currentDuration) {
                        return TimeUnit.SECONDS.toNanos(parameterService.getParameters().getCacheExpirySeconds());
                    }

                    @Override
                    public long expireAfterRead(EstimateKey key, PointsEstimate value, long currentTime,
                                                long currentDuration) {
                        return currentDuration;
                    }
                })
                .recordStats()
                .build();
    }

    public PointsEstimate calculateExamplePoints(BigInteger principal, long durationSeconds,
                                                 boolean healthFactorHighEnough) {
        validate(principal, durationSeconds);
        return calculate(parameterService.getParameters(), principal, durationSeconds, healthFactorHighEnough);
    }

    public PointsEstimate estimateUserPoints(Long userId, BigInteger principal, long durationSeconds,
                                             boolean healthFactorHighEnough) {
        validate(principal, durationSeconds);
        EstimateKey key = new EstimateKey(userId, principal, durationSeconds, healthFactorHighEnough);
        return estimateCache.get(key, k -> computeUserEstimate(k));
    }

    public void clearUserCache(CallerContext caller, Long userId) {
        authorizationService.requireRole(LedgerAction.SET_PARAMETER, caller);
        estimateCache.asMap().keySet().removeIf(key -> key.getUserId().equals(userId));
        log.info("Estimate cache cleared: userId={}, caller={}", userId, caller.getCallerId());
    }

    public long getCachedEstimateCount() {
        estimateCache.cleanUp();
        return estimateCache.estimatedSize();
    }

    public String getCacheStats() {
        return estimateCache.stats().toString();
    }

    private PointsEstimate computeUserEstimate(EstimateKey key) {
        RewardParameters parameters = parameterService.getParameters();
        PointsEstimate plain = calculate(parameters, key.getPrincipal(), key.getDurationSeconds(),
                key.isHealthFactorHighEnough());

        int level = accountService.getAccount(key.getUserId()).getUserLevel();
        int levelBps = parameterService.getLevelMultiplier(level);
        BigInteger total = applyBps(plain.getTotalPoints(), levelBps);

        boolean dynamic = total.compareTo(parameters.getDynamicThreshold()) >= 0 && total.signum() > 0;
        if (dynamic) {
            total = applyBps(total, parameters.getDynamicMultiplierBps());
        }

        log.debug("Estimate computed: userId={}, level={}, levelBps={}, dynamic={}, total={}",
                key.getUserId(), level, levelBps, dynamic, total);
        return PointsEstimate.builder()
                .basePoints(plain.getBasePoints())
                .bonusPoints(plain.getBonusPoints())
                .totalPoints(total)
                .levelMultiplierBps(levelBps)
                .dynamicApplied(dynamic)
                .build();
    }

    static PointsEstimate calculate(RewardParameters parameters, BigInteger principal, long durationSeconds,
                                    boolean healthFactorHighEnough) {
        if (principal.signum() == 0 || durationSeconds == 0) {
            return PointsEstimate.zero();
        }

        BigInteger base = principal.divide(HUNDRED)
                .multiply(BigInteger.valueOf(durationSeconds))
                .divide(FIVE)
                .multiply(parameters.getBaseUsd())
                .divide(WAD);
        BigInteger bonus = healthFactorHighEnough ? applyBps(base, parameters.getBonusBps()) : BigInteger.ZERO;

        return PointsEstimate.builder()
                .basePoints(base)
                .bonusPoints(bonus)
                .totalPoints(base.add(bonus))
                .dynamicApplied(false)
                .build();
    }

    private static BigInteger applyBps(BigInteger amount, int bps) {
        return amount.multiply(BigInteger.valueOf(bps)).divide(BPS_DENOMINATOR);
    }

    private static void validate(BigInteger principal, long durationSeconds) {
        if (principal == null || principal.signum() < 0) {
            throw new InvalidLedgerInputException("principal must not be negative: " + principal);
        }
        if (durationSeconds < 0) {
            throw new InvalidLedgerInputException("durationSeconds must not be negative: " + durationSeconds);
        }
    }

    @Getter
    @EqualsAndHashCode
    private static final class EstimateKey {
        private final Long userId;
        private final BigInteger principal;
        private final long durationSeconds;
        private final boolean healthFactorHighEnough;

        private EstimateKey(Long userId, BigInteger principal, long durationSeconds, boolean healthFactorHighEnough) {
            this.userId = userId;
            this.principal = principal;
            this.durationSeconds = durationSeconds;
            this.healthFactorHighEnough = healthFactorHighEnough;
        }
    }
}
