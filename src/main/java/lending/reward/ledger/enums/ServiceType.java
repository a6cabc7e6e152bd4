package lending.reward.ledger.enums;

/**
 * Service families that points can be spent on.
 * Declaration order is the wire order (0..4) and the privilege bit order.
 */
public enum ServiceType {
    ADVANCED_ANALYTICS,
    PRIORITY_SERVICE,
    FEATURE_UNLOCK,
    GOVERNANCE_ACCESS,
    TESTNET_FEATURES
}
