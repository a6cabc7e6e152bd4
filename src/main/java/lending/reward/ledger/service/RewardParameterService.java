package lending.reward.ledger.service;

import lending.reward.ledger.domain.LevelMultiplier;
import lending.reward.ledger.domain.RewardParameters;
import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.exception.InvalidLedgerInputException;
import lending.reward.ledger.mapper.LevelMultiplierMapper;
import lending.reward.ledger.mapper.RewardParametersMapper;
import lending.reward.ledger.service.auth.AuthorizationService;
import lending.reward.ledger.service.auth.CallerContext;
import lending.reward.ledger.service.lock.LedgerMutationExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Administrative reward parameters and level multipliers.
 *
 * Values fall back to the configured defaults until an administrator writes them.
 */
@Slf4j
@Service
public class RewardParameterService {

    public static final int BPS_DENOMINATOR = 10_000;
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 5;

    private static final Map<Integer, Integer> DEFAULT_LEVEL_MULTIPLIERS = Map.of(
            1, 10_000,
            2, 11_000,
            3, 12_500,
            4, 15_000,
            5, 20_000);

    @Autowired
    private RewardParametersMapper parametersMapper;

    @Autowired
    private LevelMultiplierMapper multiplierMapper;

    @Autowired
    private AuthorizationService authorizationService;

    @Autowired
    private LedgerMutationExecutor mutationExecutor;

    @Value("${ledger.accrual.base-usd:100000000000000000000}")
    private BigInteger defaultBaseUsd;

    @Value("${ledger.accrual.per-day:10}")
    private long defaultPerDay;

    @Value("${ledger.accrual.bonus-bps:500}")
    private int defaultBonusBps;

    @Value("${ledger.accrual.dynamic-threshold:1000000000000000000000}")
    private BigInteger defaultDynamicThreshold;

    @Value("${ledger.accrual.dynamic-multiplier-bps:12000}")
    private int defaultDynamicMultiplierBps;

    @Value("${ledger.accrual.cache-expiry-seconds:300}")
    private long defaultCacheExpirySeconds;

    @Value("${ledger.accrual.on-time-window-seconds:86400}")
    private long defaultOnTimeWindowSeconds;

    @Value("${ledger.accrual.early-penalty-bps:0}")
    private int defaultEarlyPenaltyBps;

    @Value("${ledger.accrual.late-penalty-bps:500}")
    private int defaultLatePenaltyBps;

    @Value("${ledger.consumption.upgrade-multiplier-bps:15000}")
    private int defaultUpgradeMultiplierBps;

    public RewardParameters getParameters() {
        RewardParameters stored = parametersMapper.find();
        return stored != null ? stored : defaults();
    }

    public int getLevelMultiplier(int level) {
        requireLevel(level);
        LevelMultiplier stored = multiplierMapper.findByLevel(level);
        return stored != null ? stored.getMultiplierBps() : DEFAULT_LEVEL_MULTIPLIERS.get(level);
    }

    public Map<Integer, Integer> getLevelMultipliers() {
        Map<Integer, Integer> multipliers = new TreeMap<>(DEFAULT_LEVEL_MULTIPLIERS);
        for (LevelMultiplier stored : multiplierMapper.findAll()) {
            multipliers.put(stored.getTierLevel(), stored.getMultiplierBps());
        }
        return multipliers;
    }

    // ============= ADMINISTRATIVE SETTERS =============

    public RewardParameters updateRewardParameters(CallerContext caller, BigInteger baseUsd, long perDay,
                                                   int bonusBps, BigInteger dynamicThreshold) {
        if (baseUsd == null || baseUsd.signum() <= 0) {
            throw new InvalidLedgerInputException("baseUsd must be positive");
        }
        if (perDay <= 0) {
            throw new InvalidLedgerInputException("perDay must be positive");
        }
        requireBps("bonusBps", bonusBps);
        if (dynamicThreshold == null || dynamicThreshold.signum() < 0) {
            throw new InvalidLedgerInputException("dynamicThreshold must not be negative");
        }
        return update(caller, "updateRewardParameters", p -> p.toBuilder()
                .baseUsd(baseUsd)
                .perDay(perDay)
                .bonusBps(bonusBps)
                .dynamicThreshold(dynamicThreshold)
                .build());
    }

    public RewardParameters setHealthFactorBonus(CallerContext caller, int bonusBps) {
        requireBps("bonusBps", bonusBps);
        return update(caller, "setHealthFactorBonus", p -> p.toBuilder().bonusBps(bonusBps).build());
    }

    public RewardParameters setDynamicRewardParameters(CallerContext caller, BigInteger threshold,
                                                       int multiplierBps) {
        if (threshold == null || threshold.signum() < 0) {
            throw new InvalidLedgerInputException("dynamicThreshold must not be negative");
        }
        requireMultiplier("dynamicMultiplierBps", multiplierBps);
        return update(caller, "setDynamicRewardParameters", p -> p.toBuilder()
                .dynamicThreshold(threshold)
                .dynamicMultiplierBps(multiplierBps)
                .build());
    }

    public RewardParameters setCacheExpiry(CallerContext caller, long seconds) {
        if (seconds <= 0) {
            throw new InvalidLedgerInputException("cacheExpirySeconds must be positive");
        }
        return update(caller, "setCacheExpiry", p -> p.toBuilder().cacheExpirySeconds(seconds).build());
    }

    public RewardParameters setOnTimeWindow(CallerContext caller, long seconds) {
        if (seconds < 0) {
            throw new InvalidLedgerInputException("onTimeWindowSeconds must not be negative");
        }
        return update(caller, "setOnTimeWindow", p -> p.toBuilder().onTimeWindowSeconds(seconds).build());
    }

    public RewardParameters setPenaltyBps(CallerContext caller, int earlyBps, int lateBps) {
        requireBps("earlyPenaltyBps", earlyBps);
        requireBps("latePenaltyBps", lateBps);
        return update(caller, "setPenaltyBps", p -> p.toBuilder()
                .earlyPenaltyBps(earlyBps)
                .latePenaltyBps(lateBps)
                .build());
    }

    public RewardParameters setUpgradeMultiplier(CallerContext caller, int multiplierBps) {
        requireMultiplier("upgradeMultiplierBps", multiplierBps);
        return update(caller, "setUpgradeMultiplier", p -> p.toBuilder().upgradeMultiplierBps(multiplierBps).build());
    }

    public void setLevelMultiplier(CallerContext caller, int level, int multiplierBps) {
        authorizationService.requireRole(LedgerAction.SET_PARAMETER, caller);
        requireLevel(level);
        requireMultiplier("multiplierBps", multiplierBps);

        mutationExecutor.execute("setLevelMultiplier", () -> {
            LevelMultiplier multiplier = LevelMultiplier.builder()
                    .tierLevel(level)
                    .multiplierBps(multiplierBps)
                    .build();
            if (multiplierMapper.findByLevel(level) == null) {
                multiplierMapper.insert(multiplier);
            } else {
                multiplierMapper.update(multiplier);
            }
            log.info("Level multiplier updated: level={}, multiplierBps={}, caller={}",
                    level, multiplierBps, caller.getCallerId());
            return null;
        });
    }

    public static void requireLevel(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new InvalidLedgerInputException("Level must be between " + MIN_LEVEL + " and " + MAX_LEVEL
                    + ": " + level);
        }
    }

    private RewardParameters update(CallerContext caller, String operation, UnaryOperator<RewardParameters> change) {
        authorizationService.requireRole(LedgerAction.SET_PARAMETER, caller);

        return mutationExecutor.execute(operation, () -> {
            RewardParameters stored = parametersMapper.find();
            RewardParameters updated = change.apply(stored != null ? stored : defaults());
            if (stored == null) {
                parametersMapper.insert(updated);
            } else {
                parametersMapper.update(updated);
            }
            log.info("Reward parameters updated: operation={}, caller={}, parameters={}",
                    operation, caller.getCallerId(), updated);
            return updated;
        });
    }

    private RewardParameters defaults() {
        return RewardParameters.builder()
                .baseUsd(defaultBaseUsd)
                .perDay(defaultPerDay)
                .bonusBps(defaultBonusBps)
                .dynamicThreshold(defaultDynamicThreshold)
                .dynamicMultiplierBps(defaultDynamicMultiplierBps)
                .cacheExpirySeconds(defaultCacheExpirySeconds)
                .onTimeWindowSeconds(defaultOnTimeWindowSeconds)
                .earlyPenaltyBps(defaultEarlyPenaltyBps)
                .latePenaltyBps(defaultLatePenaltyBps)
                .upgradeMultiplierBps(defaultUpgradeMultiplierBps)
                .build();
    }

    private static void requireBps(String name, int bps) {
        if (bps < 0 || bps > BPS_DENOMINATOR) {
            throw new InvalidLedgerInputException(name + " must be between 0 and " + BPS_DENOMINATOR + ": " + bps);
        }
    }

    private static void requireMultiplier(String name, int bps) {
        if (bps <= 0) {
            throw new InvalidLedgerInputException(name + " must be positive: " + bps);
        }
    }
}
