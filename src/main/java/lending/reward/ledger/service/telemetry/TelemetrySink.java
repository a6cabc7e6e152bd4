package lending.reward.ledger.service.telemetry;

import lending.reward.ledger.event.LedgerTelemetryEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Downstream read model receiving ledger state changes.
 * Implementations may fail synchronously or through the returned future; both are treated the same.
 */
public interface TelemetrySink {

    CompletableFuture<?> push(LedgerTelemetryEvent event);
}
