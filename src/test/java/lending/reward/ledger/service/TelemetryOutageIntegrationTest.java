package lending.reward.ledger.service;

import io.micrometer.core.instrument.MeterRegistry;
import lending.reward.ledger.BaseIntegrationTest;
import lending.reward.ledger.domain.ConsumptionRecord;
import lending.reward.ledger.domain.OrderLock;
import lending.reward.ledger.dto.AccrualResult;
import lending.reward.ledger.enums.AccrualAction;
import lending.reward.ledger.enums.LoanOutcome;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lending.reward.ledger.service.telemetry.TelemetryDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Ledger mutations against a sink that fails or stalls
 * The mutation commits regardless and the failure only shows up in telemetry counters
 */
@DisplayName("Telemetry Outage Integration Tests")
class TelemetryOutageIntegrationTest extends BaseIntegrationTest {

    private static final Long BUYER = 601L;
    private static final Long OTHER_BUYER = 602L;
    private static final Long BORROWER = 603L;

    @Autowired
    private ConsumptionEngineService consumptionEngine;

    @Autowired
    private AccrualEngineService accrualEngine;

    @Autowired
    private TelemetryDispatcher telemetryDispatcher;

    @Autowired
    private MeterRegistry meterRegistry;

    private double failedPushes() {
        return meterRegistry.get("ledger.telemetry.push.failed").counter().count();
    }

    private void awaitFailedPushes(double atLeast) {
        await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(failedPushes()).isGreaterThanOrEqualTo(atLeast));
    }

    @Test
    @DisplayName("Purchase commits when the sink throws")
    void testConsume_SinkThrows() {
        // GIVEN: Sink fails synchronously on every push
        fund(BUYER, "150");
        double failedBefore = failedPushes();
        when(telemetrySink.push(any())).thenThrow(new IllegalStateException("broker unreachable"));

        // WHEN
        ConsumptionRecord record = consumptionEngine.consumeService(CONSUMPTION_GATEWAY, BUYER,
                ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC);

        // THEN: Burn, history and cooldown are all in place
        assertThat(record.getId()).isNotNull();
        assertBalance(BUYER, "50");
        assertThat(consumptionEngine.getUserConsumptions(BUYER)).hasSize(1);
        assertThat(consumptionEngine.getServiceCooldownRemaining(BUYER, ServiceType.ADVANCED_ANALYTICS))
                .isEqualTo(ONE_DAY);

        // Burn and privilege events both failed and were parked
        awaitFailedPushes(failedBefore + 2);
        assertThat(telemetryDispatcher.getDeadLetterCount()).isGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("Order borrow commits when the sink returns a failed future")
    void testOrderBorrow_SinkFutureFails() {
        // GIVEN: Sink accepts the call but delivery fails
        double failedBefore = failedPushes();
        when(telemetrySink.push(any())).thenAnswer(invocation ->
                CompletableFuture.failedFuture(new IllegalStateException("delivery timeout")));
        long maturity = clock.epochSecond() + 30 * ONE_DAY;

        // WHEN
        AccrualResult result = accrualEngine.onLoanEventV2(LENDING_ENGINE, BORROWER, 21L, usdc(5000), maturity,
                LoanOutcome.BORROW);

        // THEN: Lock is recorded
        assertThat(result.getAction()).isEqualTo(AccrualAction.LOCKED);
        OrderLock lock = accrualEngine.getOrderLock(21L);
        assertThat(lock).isNotNull();
        assertThat(lock.getBorrower()).isEqualTo(BORROWER);
        assertThat(accountService.getOrderLockedPoints(BORROWER)).isEqualTo(points("1"));

        awaitFailedPushes(failedBefore + 1);
    }

    @Test
    @DisplayName("Stalled sink does not hold the ledger lock against other mutations")
    void testStalledSink_DoesNotBlockOtherMutations() throws Exception {
        // GIVEN: Every push stalls longer than the lock wait, like a producer during a broker outage
        fund(BUYER, "150");
        fund(OTHER_BUYER, "150");
        CountDownLatch brokerBack = new CountDownLatch(1);
        when(telemetrySink.push(any())).thenAnswer(invocation -> {
            brokerBack.await(8, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(null);
        });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            // WHEN: Two unrelated purchases, the second 200 ms after the first
            Future<ConsumptionRecord> first = executor.submit(() -> consumptionEngine.consumeService(
                    CONSUMPTION_GATEWAY, BUYER, ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC));
            Thread.sleep(200);
            Future<ConsumptionRecord> second = executor.submit(() -> consumptionEngine.consumeService(
                    CONSUMPTION_GATEWAY, OTHER_BUYER, ServiceType.ADVANCED_ANALYTICS, ServiceLevel.BASIC));

            // THEN: Both complete well before the sink recovers
            assertThat(first.get(3, TimeUnit.SECONDS).getId()).isNotNull();
            assertThat(second.get(3, TimeUnit.SECONDS).getId()).isNotNull();
            assertBalance(BUYER, "50");
            assertBalance(OTHER_BUYER, "50");
        } finally {
            brokerBack.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
    }
}
