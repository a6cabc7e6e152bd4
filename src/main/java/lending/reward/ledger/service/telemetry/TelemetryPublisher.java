package lending.reward.ledger.service.telemetry;

import lending.reward.ledger.enums.TelemetryEventType;
import lending.reward.ledger.event.LedgerTelemetryEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Emits telemetry from inside a ledger transaction. Events only reach the sink once the
 * transaction commits, a rolled back mutation emits nothing.
 */
@Component
public class TelemetryPublisher {

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    public void rewardEarned(Long userId, BigInteger minted, String detail) {
        publish(LedgerTelemetryEvent.of(TelemetryEventType.REWARD_EARNED, userId, minted, null, detail));
    }

    public void pointsLocked(Long userId, BigInteger locked, String detail) {
        publish(LedgerTelemetryEvent.of(TelemetryEventType.POINTS_LOCKED, userId, locked, null, detail));
    }

    public void pointsBurned(Long userId, BigInteger burned, String detail) {
        publish(LedgerTelemetryEvent.of(TelemetryEventType.POINTS_BURNED, userId, burned, null, detail));
    }

    public void debtChanged(Long userId, BigInteger newDebt) {
        publish(LedgerTelemetryEvent.of(TelemetryEventType.DEBT_CHANGED, userId, newDebt, null, null));
    }

    public void levelChanged(Long userId, int newLevel) {
        publish(LedgerTelemetryEvent.of(TelemetryEventType.LEVEL_CHANGED, userId, null, (long) newLevel, null));
    }

    public void privilegeChanged(Long userId, long packedPrivilege) {
        publish(LedgerTelemetryEvent.of(TelemetryEventType.PRIVILEGE_CHANGED, userId, null, packedPrivilege, null));
    }

    public void statsUpdated(long totalBatchOperations, BigInteger totalPointsMinted) {
        publish(LedgerTelemetryEvent.of(TelemetryEventType.STATS_UPDATED, null, totalPointsMinted,
                totalBatchOperations, null));
    }

    private void publish(LedgerTelemetryEvent event) {
        eventPublisher.publishEvent(event);
    }
}
