package lending.reward.ledger.service.catalog;

import lending.reward.ledger.domain.ServiceConfig;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable catalog handle built from a fixed set of level configs
 */
public class StaticServiceCatalogHandle implements ServiceCatalogHandle {

    private final ServiceType serviceType;
    private final long cooldownSeconds;
    private final Map<ServiceLevel, ServiceConfig> configs;

    private StaticServiceCatalogHandle(ServiceType serviceType, long cooldownSeconds,
                                       Map<ServiceLevel, ServiceConfig> configs) {
        this.serviceType = serviceType;
        this.cooldownSeconds = cooldownSeconds;
        this.configs = Collections.unmodifiableMap(new EnumMap<>(configs));
    }

    public static Builder builder(ServiceType serviceType) {
        return new Builder(serviceType);
    }

    @Override
    public ServiceType getServiceType() {
        return serviceType;
    }

    @Override
    public ServiceConfig getConfig(ServiceLevel level) {
        return configs.get(level);
    }

    @Override
    public long getCooldownSeconds() {
        return cooldownSeconds;
    }

    public static class Builder {
        private final ServiceType serviceType;
        private long cooldownSeconds;
        private final Map<ServiceLevel, ServiceConfig> configs = new EnumMap<>(ServiceLevel.class);

        private Builder(ServiceType serviceType) {
            this.serviceType = serviceType;
        }

        public Builder cooldownSeconds(long cooldownSeconds) {
            this.cooldownSeconds = cooldownSeconds;
            return this;
        }

        public Builder level(ServiceLevel level, BigInteger price, long durationSeconds, String description) {
            return level(level, price, durationSeconds, true, description);
        }

        public Builder level(ServiceLevel level, BigInteger price, long durationSeconds, boolean active,
                             String description) {
            configs.put(level, ServiceConfig.builder()
                    .serviceType(serviceType)
                    .serviceLevel(level)
                    .price(price)
                    .durationSeconds(durationSeconds)
                    .active(active)
                    .description(description)
                    .build());
            return this;
        }

        public StaticServiceCatalogHandle build() {
            return new StaticServiceCatalogHandle(serviceType, cooldownSeconds, configs);
        }
    }
}
