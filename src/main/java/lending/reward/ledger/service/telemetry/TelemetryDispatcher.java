package lending.reward.ledger.service.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lending.reward.ledger.event.LedgerTelemetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Forwards committed telemetry events to the sink.
 *
 * Delivery never fails the ledger operation and never runs on the thread that emitted the event:
 * the listener hands the push to the telemetry executor and returns. A failed or rejected push is
 * counted, logged and parked in a bounded dead-letter queue that a scheduled job retries.
 * When the queue is full the event is dropped.
 */
@Slf4j
@Component
public class TelemetryDispatcher {

    @Autowired
    private TelemetrySink telemetrySink;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    @Qualifier("telemetryExecutor")
    private TaskExecutor telemetryExecutor;

    @Value("${ledger.telemetry.dead-letter-capacity:10000}")
    private int deadLetterCapacity;

    private BlockingQueue<LedgerTelemetryEvent> deadLetters;

    private Counter pushedCounter;
    private Counter failedCounter;
    private Counter droppedCounter;

    @PostConstruct
    public void init() {
        deadLetters = new LinkedBlockingQueue<>(deadLetterCapacity);
        pushedCounter = Counter.builder("ledger.telemetry.pushed")
                .description("Telemetry events accepted by the sink")
                .register(meterRegistry);
        failedCounter = Counter.builder("ledger.telemetry.push.failed")
                .description("Telemetry pushes that failed and were dead-lettered")
                .register(meterRegistry);
        droppedCounter = Counter.builder("ledger.telemetry.dead_letter.dropped")
                .description("Telemetry events dropped because the dead-letter queue was full")
                .register(meterRegistry);
    }

    /**
     * Schedule delivery once the emitting transaction has committed.
     * Runs while the ledger lock is still held, so it only enqueues.
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTelemetryEvent(LedgerTelemetryEvent event) {
        try {
            telemetryExecutor.execute(() -> deliver(event));
        } catch (TaskRejectedException e) {
            handleFailure(event, e);
        }
    }

    /**
     * Push one event, routing any failure to the dead-letter queue
     */
    public void deliver(LedgerTelemetryEvent event) {
        try {
            CompletableFuture<?> future = telemetrySink.push(event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    pushedCounter.increment();
                } else {
                    handleFailure(event, ex);
                }
            });
        } catch (RuntimeException e) {
            handleFailure(event, e);
        }
    }

    /**
     * Retry parked events. Events that fail again go back to the queue.
     */
    @Scheduled(fixedDelayString = "${ledger.telemetry.retry-interval-ms:30000}")
    public void retryDeadLetters() {
        List<LedgerTelemetryEvent> batch = new ArrayList<>();
        deadLetters.drainTo(batch);
        if (batch.isEmpty()) {
            return;
        }

        log.info("Retrying dead-lettered telemetry: count={}", batch.size());
        for (LedgerTelemetryEvent event : batch) {
            deliver(event);
        }
    }

    public int getDeadLetterCount() {
        return deadLetters.size();
    }

    private void handleFailure(LedgerTelemetryEvent event, Throwable cause) {
        failedCounter.increment();
        log.warn("Telemetry push failed: type={}, userId={}, messageId={}, error={}",
                event.getType(), event.getUserId(), event.getMessageId(), cause.getMessage());

        if (!deadLetters.offer(event)) {
            droppedCounter.increment();
            log.error("Telemetry dead-letter queue full, dropping event: type={}, userId={}, messageId={}",
                    event.getType(), event.getUserId(), event.getMessageId());
        }
    }
}
