package lending.reward.ledger.enums;

/**
 * Kinds of state change mirrored to the external read model
 */
public enum TelemetryEventType {
    REWARD_EARNED,
    POINTS_LOCKED,
    POINTS_BURNED,
    DEBT_CHANGED,
    LEVEL_CHANGED,
    PRIVILEGE_CHANGED,
    STATS_UPDATED
}
