package lending.reward.ledger.enums;

/**
 * Tier of a purchased service, ordered from cheapest to most expensive
 */
public enum ServiceLevel {
    BASIC,
    STANDARD,
    PREMIUM,
    VIP;

    /**
     * Compact code used in the packed privilege summary (0 means no access)
     */
    public int code() {
        return ordinal() + 1;
    }

    public static ServiceLevel fromCode(int code) {
        if (code <= 0) {
            return null;
        }
        ServiceLevel[] levels = values();
        if (code > levels.length) {
            throw new IllegalArgumentException("Unknown service level code: " + code);
        }
        return levels[code - 1];
    }

    public boolean isAbove(ServiceLevel other) {
        return other == null || ordinal() > other.ordinal();
    }
}
