package lending.reward.ledger.service.telemetry;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lending.reward.ledger.enums.TelemetryEventType;
import lending.reward.ledger.event.LedgerTelemetryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for best-effort telemetry delivery and the dead-letter queue
 */
@DisplayName("Telemetry Dispatcher Tests")
class TelemetryDispatcherTest {

    private TelemetrySink sink;
    private MeterRegistry meterRegistry;
    private TelemetryDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        sink = mock(TelemetrySink.class);
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = newDispatcher(10);
    }

    private TelemetryDispatcher newDispatcher(int capacity) {
        return newDispatcher(capacity, new SyncTaskExecutor());
    }

    private TelemetryDispatcher newDispatcher(int capacity, TaskExecutor executor) {
        TelemetryDispatcher created = new TelemetryDispatcher();
        ReflectionTestUtils.setField(created, "telemetrySink", sink);
        ReflectionTestUtils.setField(created, "meterRegistry", meterRegistry);
        ReflectionTestUtils.setField(created, "telemetryExecutor", executor);
        ReflectionTestUtils.setField(created, "deadLetterCapacity", capacity);
        created.init();
        return created;
    }

    private static LedgerTelemetryEvent event() {
        return LedgerTelemetryEvent.of(TelemetryEventType.REWARD_EARNED, 1L, BigInteger.ONE, null, null);
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("Accepted push is counted and nothing is parked")
    void testDeliver_Success() {
        when(sink.push(any())).thenAnswer(invocation -> CompletableFuture.completedFuture(null));

        dispatcher.onTelemetryEvent(event());

        assertThat(count("ledger.telemetry.pushed")).isEqualTo(1.0);
        assertThat(count("ledger.telemetry.push.failed")).isZero();
        assertThat(dispatcher.getDeadLetterCount()).isZero();
    }

    @Test
    @DisplayName("Synchronous sink failure is dead-lettered")
    void testDeliver_SynchronousFailure() {
        when(sink.push(any())).thenThrow(new IllegalStateException("broker down"));

        dispatcher.deliver(event());

        assertThat(count("ledger.telemetry.push.failed")).isEqualTo(1.0);
        assertThat(dispatcher.getDeadLetterCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Failed future is dead-lettered")
    void testDeliver_AsyncFailure() {
        when(sink.push(any())).thenAnswer(invocation ->
                CompletableFuture.failedFuture(new IllegalStateException("timeout")));

        dispatcher.deliver(event());

        assertThat(count("ledger.telemetry.push.failed")).isEqualTo(1.0);
        assertThat(dispatcher.getDeadLetterCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Sink returning no future counts as a failure")
    void testDeliver_NullFuture() {
        when(sink.push(any())).thenAnswer(invocation -> null);

        dispatcher.deliver(event());

        assertThat(dispatcher.getDeadLetterCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Retry drains the queue once the sink recovers")
    void testRetry_DrainsOnRecovery() {
        when(sink.push(any()))
                .thenThrow(new IllegalStateException("down"))
                .thenAnswer(invocation -> CompletableFuture.completedFuture(null));
        LedgerTelemetryEvent event = event();
        dispatcher.deliver(event);
        assertThat(dispatcher.getDeadLetterCount()).isEqualTo(1);

        dispatcher.retryDeadLetters();

        assertThat(dispatcher.getDeadLetterCount()).isZero();
        assertThat(count("ledger.telemetry.pushed")).isEqualTo(1.0);
        verify(sink, times(2)).push(event);
    }

    @Test
    @DisplayName("Retry puts still-failing events back")
    void testRetry_StillFailing() {
        when(sink.push(any())).thenThrow(new IllegalStateException("down"));
        dispatcher.deliver(event());

        dispatcher.retryDeadLetters();

        assertThat(dispatcher.getDeadLetterCount()).isEqualTo(1);
        assertThat(count("ledger.telemetry.push.failed")).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Full queue drops the event and counts the drop")
    void testDeadLetter_Overflow() {
        dispatcher = newDispatcher(2);
        when(sink.push(any())).thenThrow(new IllegalStateException("down"));

        for (int i = 0; i < 3; i++) {
            dispatcher.deliver(event());
        }

        assertThat(dispatcher.getDeadLetterCount()).isEqualTo(2);
        assertThat(count("ledger.telemetry.dead_letter.dropped")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Listener returns while a slow sink is still pushing")
    void testOnTelemetryEvent_DoesNotWaitForSink() throws InterruptedException {
        // GIVEN: A sink that blocks like a producer during a broker outage
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.initialize();
        dispatcher = newDispatcher(10, executor);

        CountDownLatch release = new CountDownLatch(1);
        when(sink.push(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return CompletableFuture.completedFuture(null);
        });

        try {
            // WHEN
            long start = System.nanoTime();
            dispatcher.onTelemetryEvent(event());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            // THEN: The caller is back immediately, the push completes later
            assertThat(elapsedMs).isLessThan(1000);
            verify(sink, timeout(2000)).push(any());
            assertThat(count("ledger.telemetry.pushed")).isZero();

            release.countDown();
            executor.shutdown();
            assertThat(executor.getThreadPoolExecutor().awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            assertThat(count("ledger.telemetry.pushed")).isEqualTo(1.0);
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("Saturated executor parks the event instead of running it inline")
    void testOnTelemetryEvent_RejectedIsDeadLettered() {
        dispatcher = newDispatcher(10, task -> {
            throw new TaskRejectedException("telemetry executor saturated");
        });

        dispatcher.onTelemetryEvent(event());

        verify(sink, times(0)).push(any());
        assertThat(count("ledger.telemetry.push.failed")).isEqualTo(1.0);
        assertThat(dispatcher.getDeadLetterCount()).isEqualTo(1);
    }
}
