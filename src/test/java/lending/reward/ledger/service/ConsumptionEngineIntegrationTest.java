package lending.reward.ledger.service;

import lending.reward.ledger.BaseIntegrationTest;
import lending.reward.ledger.domain.ConsumptionRecord;
import lending.reward.ledger.domain.UserPrivilege;
import lending.reward.ledger.dto.BatchConsumptionResult;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lending.reward.ledger.enums.TelemetryEventType;
import lending.reward.ledger.exception.CatalogUnavailableException;
import lending.reward.ledger.exception.CooldownNotElapsedException;
import lending.reward.ledger.exception.InsufficientBalanceException;
import lending.reward.ledger.exception.InvalidLedgerInputException;
import lending.reward.ledger.exception.ServiceInactiveException;
import lending.reward.ledger.exception.UnauthorizedCallerException;
import lending.reward.ledger.service.catalog.StaticServiceCatalogHandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for ConsumptionEngineService
 * Purchases, cooldowns, upgrades, privilege derivation and strict batches
 */
@DisplayName("Consumption Engine Integration Tests")
class ConsumptionEngineIntegrationTest extends BaseIntegrationTest {

    private static final Long USER = 301L;
    private static final Long OTHER = 302L;

    @Autowired
    private ConsumptionEngineService consumptionEngine;

    @Autowired
    private PrivilegeService privilegeService;

    @Autowired
    private LedgerStatisticsService statisticsService;

    @Test
    @DisplayName("Purchase burns the price, grants the privilege and starts the cooldown")
    void testConsume_Basic() {
        // GIVEN: 150 points
        fund(USER, "150");

        // WHEN: Basic analytics bought for 100 points
        ConsumptionRecord record = consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC);

        // THEN: Balance, history, privilege and cooldown updated
        assertThat(record.getId()).isNotNull();
        assertThat(record.getPoints()).isEqualTo(points("100"));
        assertThat(record.getExpirationTime()).isEqualTo(clock.epochSecond() + 30 * ONE_DAY);
        assertBalance(USER, "50");

        assertThat(consumptionEngine.getUserConsumptions(USER)).hasSize(1);

        UserPrivilege privilege = privilegeService.getUserPrivilege(USER);
        assertThat(privilege.hasAccess(ServiceType.ADVANCED_ANALYTICS)).isTrue();
        assertThat(privilege.levelOf(ServiceType.ADVANCED_ANALYTICS)).isEqualTo(ServiceLevel.BASIC);
        assertThat(privilege.hasAccess(ServiceType.PRIORITY_SERVICE)).isFalse();

        assertThat(consumptionEngine.getServiceCooldownRemaining(USER, ServiceType.ADVANCED_ANALYTICS))
                .isEqualTo(ONE_DAY);
        assertThat(statisticsService.getStatistics().getTotalConsumptions()).isEqualTo(1L);

        awaitPushedEvents(events -> assertThat(events)
                .filteredOn(e -> e.getType() == TelemetryEventType.PRIVILEGE_CHANGED)
                .singleElement()
                .satisfies(e -> assertThat(e.getValue()).isEqualTo(1L + (1L << 5))));
    }

    @Test
    @DisplayName("Second purchase inside the cooldown is rejected with the remaining time")
    void testConsume_Cooldown() {
        fund(USER, "1000");
        consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER, ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC);
        clock.advanceSeconds(3600);

        // WHEN: Bought again an hour later
        assertThatThrownBy(() -> consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC))
                .isInstanceOfSatisfying(CooldownNotElapsedException.class,
                        e -> assertThat(e.getRemainingSeconds()).isEqualTo(ONE_DAY - 3600));
        assertBalance(USER, "900");

        // THEN: Allowed once the cooldown has passed
        clock.advanceSeconds(ONE_DAY - 3600);
        consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER, ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC);
        assertBalance(USER, "800");
    }

    @Test
    @DisplayName("Cooldown is tracked per service type")
    void testConsume_CooldownPerType() {
        fund(USER, "1000");
        consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER, ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC);

        consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER, ServiceType.TESTNET_FEATURES, ServiceLevel.BASIC);

        assertBalance(USER, "850");
    }

    @Test
    @DisplayName("Insufficient balance leaves history and cooldown untouched")
    void testConsume_InsufficientBalance() {
        fund(USER, "99");

        assertThatThrownBy(() -> consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC))
                .isInstanceOf(InsufficientBalanceException.class);

        assertBalance(USER, "99");
        assertThat(consumptionEngine.getUserConsumptions(USER)).isEmpty();
        assertThat(consumptionEngine.getServiceCooldownRemaining(USER, ServiceType.ADVANCED_ANALYTICS)).isZero();
    }

    @Test
    @DisplayName("Inactive level cannot be bought")
    void testConsume_Inactive() {
        fund(USER, "1000");
        serviceCatalog.register(StaticServiceCatalogHandle.builder(ServiceType.FEATURE_UNLOCK)
                .cooldownSeconds(ONE_DAY)
                .level(ServiceLevel.BASIC, points("10"), 30 * ONE_DAY, false, "Retired tool")
                .build());

        assertThatThrownBy(() -> consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.FEATURE_UNLOCK, ServiceLevel.BASIC))
                .isInstanceOf(ServiceInactiveException.class);
        assertThatThrownBy(() -> consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.FEATURE_UNLOCK, ServiceLevel.VIP))
                .isInstanceOf(ServiceInactiveException.class);
    }

    @Test
    @DisplayName("Service type missing from the catalog is unavailable")
    void testConsume_CatalogUnavailable() {
        fund(USER, "1000");
        serviceCatalog.unregister(ServiceType.GOVERNANCE_ACCESS);

        assertThatThrownBy(() -> consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.GOVERNANCE_ACCESS, ServiceLevel.BASIC))
                .isInstanceOf(CatalogUnavailableException.class);
        assertBalance(USER, "1000");
    }

    @Test
    @DisplayName("Free level is recorded without burning")
    void testConsume_FreeLevel() {
        serviceCatalog.register(StaticServiceCatalogHandle.builder(ServiceType.TESTNET_FEATURES)
                .cooldownSeconds(60)
                .level(ServiceLevel.BASIC, BigInteger.ZERO, ONE_DAY, "Free preview")
                .build());

        ConsumptionRecord record = consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.TESTNET_FEATURES, ServiceLevel.BASIC);

        assertThat(record.getPoints()).isZero();
        assertThat(privilegeService.getUserPrivilege(USER).hasAccess(ServiceType.TESTNET_FEATURES)).isTrue();
    }

    @Test
    @DisplayName("Upgrade costs the new price times the upgrade multiplier")
    void testUpgrade_ChargesMultiplier() {
        // GIVEN: Basic analytics active, cooldown passed
        fund(USER, "1000");
        consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER, ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC);
        clock.advanceSeconds(ONE_DAY);

        // WHEN: Upgraded to standard (500 * 1.5)
        ConsumptionRecord record = consumptionEngine.upgradeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.STANDARD);

        // THEN: 750 burned, privilege at standard
        assertThat(record.getPoints()).isEqualTo(points("750"));
        assertThat(record.getUpgrade()).isTrue();
        assertBalance(USER, "150");
        assertThat(privilegeService.getUserPrivilege(USER).levelOf(ServiceType.ADVANCED_ANALYTICS))
                .isEqualTo(ServiceLevel.STANDARD);
    }

    @Test
    @DisplayName("Upgrade needs an active lower level")
    void testUpgrade_RequiresLowerActiveLevel() {
        fund(USER, "5000");

        assertThatThrownBy(() -> consumptionEngine.upgradeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.PREMIUM))
                .isInstanceOf(InvalidLedgerInputException.class);

        consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER, ServiceType.ADVANCED_ANALYTICS, ServiceLevel.PREMIUM);
        clock.advanceSeconds(ONE_DAY);

        assertThatThrownBy(() -> consumptionEngine.upgradeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.STANDARD))
                .isInstanceOf(InvalidLedgerInputException.class);
        assertThatThrownBy(() -> consumptionEngine.upgradeService(CONSUMPTION_GATEWAY, USER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.PREMIUM))
                .isInstanceOf(InvalidLedgerInputException.class);
    }

    @Test
    @DisplayName("Privilege lapses when the purchase expires")
    void testPrivilege_Expires() {
        fund(USER, "100");
        consumptionEngine.consumeService(CONSUMPTION_GATEWAY, USER, ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC);

        clock.advanceSeconds(30 * ONE_DAY);

        UserPrivilege privilege = privilegeService.getUserPrivilege(USER);
        assertThat(privilege.hasAccess(ServiceType.ADVANCED_ANALYTICS)).isFalse();
        assertThat(privilege.pack()).isZero();
        assertThat(consumptionEngine.getUserConsumptions(USER)).hasSize(1);
    }

    @Test
    @DisplayName("Batch purchases every item")
    void testBatch_AllSucceed() {
        fund(USER, "1000");
        fund(OTHER, "1000");

        BatchConsumptionResult result = consumptionEngine.batchConsumeServices(CONSUMPTION_GATEWAY,
                List.of(USER, OTHER),
                List.of(ServiceType.ADVANCED_ANALYTICS, ServiceType.PRIORITY_SERVICE),
                List.of(ServiceLevel.BASIC, ServiceLevel.STANDARD));

        assertThat(result.getRecords()).hasSize(2);
        assertThat(result.getTotalPoints()).isEqualTo(points("600"));
        assertBalance(USER, "900");
        assertBalance(OTHER, "500");
        assertThat(statisticsService.getStatistics().getTotalBatchOperations()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Batch with one failing item rolls back every item")
    void testBatch_StrictRollback() {
        fund(USER, "1000");
        fund(OTHER, "10");

        assertThatThrownBy(() -> consumptionEngine.batchConsumeServices(CONSUMPTION_GATEWAY,
                List.of(USER, OTHER),
                List.of(ServiceType.ADVANCED_ANALYTICS, ServiceType.PRIORITY_SERVICE),
                List.of(ServiceLevel.BASIC, ServiceLevel.BASIC)))
                .isInstanceOf(InsufficientBalanceException.class);

        assertBalance(USER, "1000");
        assertBalance(OTHER, "10");
        assertThat(consumptionEngine.getUserConsumptions(USER)).isEmpty();
        assertThat(consumptionEngine.getServiceCooldownRemaining(USER, ServiceType.ADVANCED_ANALYTICS)).isZero();
    }

    @Test
    @DisplayName("Purchases require the consumption role")
    void testConsume_Unauthorized() {
        fund(USER, "1000");

        assertThatThrownBy(() -> consumptionEngine.consumeService(LENDING_ENGINE, USER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC))
                .isInstanceOf(UnauthorizedCallerException.class);
        assertBalance(USER, "1000");
    }
}
