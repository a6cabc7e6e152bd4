package lending.reward.ledger.service;

import lending.reward.ledger.domain.ConsumptionRecord;
import lending.reward.ledger.domain.LedgerStatistics;
import lending.reward.ledger.domain.ServiceConfig;
import lending.reward.ledger.domain.ServiceCooldown;
import lending.reward.ledger.dto.BatchConsumptionResult;
import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lending.reward.ledger.exception.CatalogUnavailableException;
import lending.reward.ledger.exception.CooldownNotElapsedException;
import lending.reward.ledger.exception.InsufficientBalanceException;
import lending.reward.ledger.exception.InvalidLedgerInputException;
import lending.reward.ledger.exception.ServiceInactiveException;
import lending.reward.ledger.mapper.ConsumptionRecordMapper;
import lending.reward.ledger.mapper.ServiceCooldownMapper;
import lending.reward.ledger.service.auth.AuthorizationService;
import lending.reward.ledger.service.auth.CallerContext;
import lending.reward.ledger.service.balance.PointsBalanceService;
import lending.reward.ledger.service.catalog.ServiceCatalog;
import lending.reward.ledger.service.catalog.ServiceCatalogHandle;
import lending.reward.ledger.service.lock.LedgerMutationExecutor;
import lending.reward.ledger.service.telemetry.TelemetryPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Spends points on catalog services.
 *
 * A purchase checks availability, the per-(user, service type) cooldown and the balance, then burns
 * the price, appends a consumption record and recomputes the user's privileges. Any failed check
 * aborts the purchase with nothing charged.
 */
@Slf4j
@Service
public class ConsumptionEngineService {

    public static final int MAX_BATCH_SIZE = 100;

    /**
     * Identity this engine uses against the points balance
     */
    public static final String ENGINE_ID = "consumption-engine";

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(RewardParameterService.BPS_DENOMINATOR);

    @Autowired
    private AuthorizationService authorizationService;

    @Autowired
    private LedgerMutationExecutor mutationExecutor;

    @Autowired
    private ServiceCatalog serviceCatalog;

    @Autowired
    private PointsBalanceService pointsBalance;

    @Autowired
    private ConsumptionRecordMapper recordMapper;

    @Autowired
    private ServiceCooldownMapper cooldownMapper;

    @Autowired
    private PrivilegeService privilegeService;

    @Autowired
    private RewardParameterService parameterService;

    @Autowired
    private LedgerStatisticsService statisticsService;

    @Autowired
    private TelemetryPublisher telemetry;

    @Autowired
    private Clock clock;

    public ConsumptionRecord consumeService(CallerContext caller, Long userId, ServiceType serviceType,
                                            ServiceLevel serviceLevel) {
        authorizationService.requireRole(LedgerAction.CONSUME_SERVICE, caller);
        validateItem(userId, serviceType, serviceLevel);

        return mutationExecutor.execute("consumeService",
                () -> purchase(userId, serviceType, serviceLevel, false));
    }

    /**
     * Move an active privilege to a higher level. Costs the new level's price times the upgrade multiplier.
     */
    public ConsumptionRecord upgradeService(CallerContext caller, Long userId, ServiceType serviceType,
                                            ServiceLevel newLevel) {
        authorizationService.requireRole(LedgerAction.CONSUME_SERVICE, caller);
        validateItem(userId, serviceType, newLevel);

        return mutationExecutor.execute("upgradeService",
                () -> purchase(userId, serviceType, newLevel, true));
    }

    /**
     * All-or-nothing batch purchase: the first failing item fails the whole batch
     */
    public BatchConsumptionResult batchConsumeServices(CallerContext caller, List<Long> userIds,
                                                       List<ServiceType> serviceTypes,
                                                       List<ServiceLevel> serviceLevels) {
        authorizationService.requireRole(LedgerAction.CONSUME_SERVICE, caller);
        int size = userIds == null ? 0 : userIds.size();
        if (size == 0) {
            throw new InvalidLedgerInputException("Batch must not be empty");
        }
        if (serviceTypes == null || serviceLevels == null
                || serviceTypes.size() != size || serviceLevels.size() != size) {
            throw new InvalidLedgerInputException("Batch arrays must have equal length");
        }
        if (size > MAX_BATCH_SIZE) {
            throw new InvalidLedgerInputException("Batch size " + size + " exceeds limit " + MAX_BATCH_SIZE);
        }
        for (int i = 0; i < size; i++) {
            validateItem(userIds.get(i), serviceTypes.get(i), serviceLevels.get(i));
        }

        return mutationExecutor.execute("batchConsumeServices", () -> {
            List<ConsumptionRecord> records = new ArrayList<>(size);
            BigInteger total = BigInteger.ZERO;
            for (int i = 0; i < size; i++) {
                ConsumptionRecord record = purchase(userIds.get(i), serviceTypes.get(i), serviceLevels.get(i), false);
                records.add(record);
                total = total.add(record.getPoints());
            }
            statisticsService.record(LedgerStatistics.builder().totalBatchOperations(1L).build());

            log.info("Batch consumption processed: size={}, totalPoints={}", size, total);
            return BatchConsumptionResult.builder()
                    .records(records)
                    .totalPoints(total)
                    .build();
        });
    }

    // ============= READS =============

    public List<ConsumptionRecord> getUserConsumptions(Long userId) {
        return recordMapper.findByUserId(userId);
    }

    /**
     * Seconds until the user may buy the service type again, 0 if available now
     */
    public long getServiceCooldownRemaining(Long userId, ServiceType serviceType) {
        ServiceCatalogHandle handle = resolve(serviceType);
        return cooldownRemaining(userId, serviceType, handle.getCooldownSeconds(), now());
    }

    // ============= PURCHASE FLOW (runs inside a mutation) =============

    private ConsumptionRecord purchase(Long userId, ServiceType serviceType, ServiceLevel level, boolean upgrade) {
        long now = now();
        ServiceCatalogHandle handle = resolve(serviceType);
        ServiceConfig config = handle.getConfig(level);
        if (config == null || !config.isActive()) {
            throw new ServiceInactiveException("Service " + serviceType + " level " + level + " is not available");
        }

        long remaining = cooldownRemaining(userId, serviceType, handle.getCooldownSeconds(), now);
        if (remaining > 0) {
            throw new CooldownNotElapsedException(
                    "Service " + serviceType + " is cooling down for user " + userId + ", " + remaining + "s left",
                    remaining);
        }

        BigInteger cost = config.getPrice();
        if (upgrade) {
            ServiceLevel current = privilegeService.activeLevel(userId, serviceType, now);
            if (current == null || !level.isAbove(current)) {
                throw new InvalidLedgerInputException("Upgrade of " + serviceType + " to " + level
                        + " requires an active lower level, current=" + current);
            }
            int multiplierBps = parameterService.getParameters().getUpgradeMultiplierBps();
            cost = cost.multiply(BigInteger.valueOf(multiplierBps)).divide(BPS_DENOMINATOR);
        }

        BigInteger balance = pointsBalance.balanceOf(userId);
        if (balance.compareTo(cost) < 0) {
            throw new InsufficientBalanceException("Insufficient points for " + serviceType + " " + level
                    + ": userId=" + userId + ", available=" + balance + ", required=" + cost);
        }
        if (cost.signum() > 0) {
            pointsBalance.burn(ENGINE_ID, userId, cost);
            telemetry.pointsBurned(userId, cost, serviceType.name());
        }

        ConsumptionRecord record = ConsumptionRecord.builder()
                .userId(userId)
                .points(cost)
                .consumedAt(now)
                .serviceType(serviceType)
                .serviceLevel(level)
                .expirationTime(now + config.getDurationSeconds())
                .upgrade(upgrade)
                .build();
        recordMapper.insert(record);
        touchCooldown(userId, serviceType, now);
        privilegeService.refresh(userId, now);

        statisticsService.record(LedgerStatistics.builder()
                .totalPointsBurned(cost)
                .totalConsumptions(1L)
                .build());

        log.info("Service {}: userId={}, serviceType={}, level={}, points={}, expiresAt={}",
                upgrade ? "upgraded" : "consumed", userId, serviceType, level, cost, record.getExpirationTime());
        return record;
    }

    private ServiceCatalogHandle resolve(ServiceType serviceType) {
        return serviceCatalog.resolve(serviceType)
                .orElseThrow(() -> new CatalogUnavailableException("No catalog entry for service " + serviceType));
    }

    private long cooldownRemaining(Long userId, ServiceType serviceType, long cooldownSeconds, long now) {
        ServiceCooldown cooldown = cooldownMapper.find(userId, serviceType);
        if (cooldown == null) {
            return 0L;
        }
        long availableAt = cooldown.getLastConsumedAt() + cooldownSeconds;
        return Math.max(0L, availableAt - now);
    }

    private void touchCooldown(Long userId, ServiceType serviceType, long now) {
        ServiceCooldown cooldown = ServiceCooldown.builder()
                .userId(userId)
                .serviceType(serviceType)
                .lastConsumedAt(now)
                .build();
        if (cooldownMapper.find(userId, serviceType) == null) {
            cooldownMapper.insert(cooldown);
        } else {
            cooldownMapper.update(cooldown);
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private static void validateItem(Long userId, ServiceType serviceType, ServiceLevel serviceLevel) {
        UserAccountService.requireUserId(userId);
        if (serviceType == null) {
            throw new InvalidLedgerInputException("serviceType is required");
        }
        if (serviceLevel == null) {
            throw new InvalidLedgerInputException("serviceLevel is required");
        }
    }
}
