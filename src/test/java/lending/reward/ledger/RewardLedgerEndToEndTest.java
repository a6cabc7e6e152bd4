package lending.reward.ledger;

import lending.reward.ledger.domain.LedgerStatistics;
import lending.reward.ledger.domain.UserPrivilege;
import lending.reward.ledger.enums.LoanOutcome;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lending.reward.ledger.service.AccrualEngineService;
import lending.reward.ledger.service.ConsumptionEngineService;
import lending.reward.ledger.service.LedgerStatisticsService;
import lending.reward.ledger.service.PrivilegeService;
import lending.reward.ledger.service.catalog.StaticServiceCatalogHandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Earn a point through a loan, then spend part of it on a service
 */
@DisplayName("Reward Ledger End-to-End Tests")
class RewardLedgerEndToEndTest extends BaseIntegrationTest {

    private static final Long BORROWER = 901L;

    @Autowired
    private AccrualEngineService accrualEngine;

    @Autowired
    private ConsumptionEngineService consumptionEngine;

    @Autowired
    private PrivilegeService privilegeService;

    @Autowired
    private LedgerStatisticsService statisticsService;

    @Test
    @DisplayName("Borrow, repay on time, buy a half-point service")
    void testEarnThenSpend() {
        // GIVEN: A half-point analytics tier
        serviceCatalog.register(StaticServiceCatalogHandle.builder(ServiceType.ADVANCED_ANALYTICS)
                .cooldownSeconds(ONE_DAY)
                .level(ServiceLevel.BASIC, points("0.5"), 30 * ONE_DAY, "Starter report")
                .build());

        // WHEN: 2000 USDC borrowed for 30 days and repaid at maturity
        long maturity = clock.epochSecond() + 30 * ONE_DAY;
        accrualEngine.onLoanEventV2(LENDING_ENGINE, BORROWER, 1L, usdc(2000), maturity, LoanOutcome.BORROW);
        clock.advanceSeconds(30 * ONE_DAY);
        accrualEngine.onLoanEventV2(LENDING_ENGINE, BORROWER, 1L, usdc(2000), maturity,
                LoanOutcome.REPAY_ON_TIME_FULL);
        assertBalance(BORROWER, "1");

        consumptionEngine.consumeService(CONSUMPTION_GATEWAY, BORROWER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC);

        // THEN: Half a point left and the privilege active
        assertBalance(BORROWER, "0.5");
        UserPrivilege privilege = privilegeService.getUserPrivilege(BORROWER);
        assertThat(privilege.hasAccess(ServiceType.ADVANCED_ANALYTICS)).isTrue();

        LedgerStatistics statistics = statisticsService.getStatistics();
        assertThat(statistics.getTotalPointsMinted()).isEqualTo(points("1"));
        assertThat(statistics.getTotalPointsBurned()).isEqualTo(points("0.5"));
        assertThat(statistics.getTotalConsumptions()).isEqualTo(1L);
    }
}
