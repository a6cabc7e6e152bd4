package lending.reward.ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lending.reward.ledger.enums.TelemetryEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.UUID;

/**
 * State change mirrored to the read model after the ledger transaction commits.
 * Published to the telemetry topic, keyed by user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerTelemetryEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Unique message ID for consumer-side deduplication (UUID)
     */
    private String messageId;

    /**
     * Event timestamp in epoch milliseconds
     */
    private Long timestamp;

    private TelemetryEventType type;

    /**
     * Affected user, null for aggregate statistics
     */
    private Long userId;

    /**
     * Point amount involved (minted, burned, locked, new debt), 18 decimals
     */
    private BigInteger amount;

    /**
     * Integer payload: new level, packed privilege summary, or counter value
     */
    private Long value;

    /**
     * Free-form context such as the order id or service type
     */
    private String detail;

    public static LedgerTelemetryEvent of(TelemetryEventType type, Long userId, BigInteger amount,
                                          Long value, String detail) {
        return LedgerTelemetryEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .timestamp(System.currentTimeMillis())
                .type(type)
                .userId(userId)
                .amount(amount)
                .value(value)
                .detail(detail)
                .build();
    }

    /**
     * Partition key, aggregate events share one partition
     */
    @JsonIgnore
    public String partitionKey() {
        return userId == null ? "aggregate" : String.valueOf(userId);
    }
}
