package lending.reward.ledger.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Services a user currently has access to, one (access, level) pair per service type.
 *
 * Packed layout: bit i is the access flag of ServiceType ordinal i, and bits 5 + 3i .. 7 + 3i
 * hold that type's level code (0 none, 1 BASIC .. 4 VIP).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserPrivilege {

    private static final int LEVEL_OFFSET = 5;
    private static final int LEVEL_BITS = 3;
    private static final long LEVEL_MASK = (1L << LEVEL_BITS) - 1;

    private Long userId;

    private boolean hasAdvancedAnalytics;
    private ServiceLevel advancedAnalyticsLevel;

    private boolean hasPriorityService;
    private ServiceLevel priorityServiceLevel;

    private boolean hasFeatureUnlock;
    private ServiceLevel featureUnlockLevel;

    private boolean hasGovernanceAccess;
    private ServiceLevel governanceAccessLevel;

    private boolean hasTestnetFeatures;
    private ServiceLevel testnetFeaturesLevel;

    public static UserPrivilege none(Long userId) {
        return UserPrivilege.builder().userId(userId).build();
    }

    public boolean hasAccess(ServiceType type) {
        switch (type) {
            case ADVANCED_ANALYTICS:
                return hasAdvancedAnalytics;
            case PRIORITY_SERVICE:
                return hasPriorityService;
            case FEATURE_UNLOCK:
                return hasFeatureUnlock;
            case GOVERNANCE_ACCESS:
                return hasGovernanceAccess;
            case TESTNET_FEATURES:
                return hasTestnetFeatures;
            default:
                throw new IllegalArgumentException("Unknown service type: " + type);
        }
    }

    /**
     * Level held for a service type, null without access
     */
    public ServiceLevel levelOf(ServiceType type) {
        switch (type) {
            case ADVANCED_ANALYTICS:
                return advancedAnalyticsLevel;
            case PRIORITY_SERVICE:
                return priorityServiceLevel;
            case FEATURE_UNLOCK:
                return featureUnlockLevel;
            case GOVERNANCE_ACCESS:
                return governanceAccessLevel;
            case TESTNET_FEATURES:
                return testnetFeaturesLevel;
            default:
                throw new IllegalArgumentException("Unknown service type: " + type);
        }
    }

    /**
     * Grant access at a level, keeping the higher level if one is already held
     */
    public void grant(ServiceType type, ServiceLevel level) {
        ServiceLevel current = levelOf(type);
        if (current != null && !level.isAbove(current)) {
            return;
        }
        switch (type) {
            case ADVANCED_ANALYTICS:
                hasAdvancedAnalytics = true;
                advancedAnalyticsLevel = level;
                break;
            case PRIORITY_SERVICE:
                hasPriorityService = true;
                priorityServiceLevel = level;
                break;
            case FEATURE_UNLOCK:
                hasFeatureUnlock = true;
                featureUnlockLevel = level;
                break;
            case GOVERNANCE_ACCESS:
                hasGovernanceAccess = true;
                governanceAccessLevel = level;
                break;
            case TESTNET_FEATURES:
                hasTestnetFeatures = true;
                testnetFeaturesLevel = level;
                break;
            default:
                throw new IllegalArgumentException("Unknown service type: " + type);
        }
    }

    @JsonIgnore
    public long pack() {
        long packed = 0L;
        for (ServiceType type : ServiceType.values()) {
            int i = type.ordinal();
            if (hasAccess(type)) {
                packed |= 1L << i;
            }
            ServiceLevel level = levelOf(type);
            if (level != null) {
                packed |= ((long) level.code()) << (LEVEL_OFFSET + LEVEL_BITS * i);
            }
        }
        return packed;
    }

    public static UserPrivilege unpack(Long userId, long packed) {
        UserPrivilege privilege = none(userId);
        for (ServiceType type : ServiceType.values()) {
            int i = type.ordinal();
            boolean access = (packed & (1L << i)) != 0;
            int code = (int) ((packed >>> (LEVEL_OFFSET + LEVEL_BITS * i)) & LEVEL_MASK);
            if (access) {
                ServiceLevel level = ServiceLevel.fromCode(code);
                privilege.grant(type, level == null ? ServiceLevel.BASIC : level);
            }
        }
        return privilege;
    }
}
