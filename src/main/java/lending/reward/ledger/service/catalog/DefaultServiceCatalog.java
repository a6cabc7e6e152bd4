package lending.reward.ledger.service.catalog;

import jakarta.annotation.PostConstruct;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * In-process catalog seeded with the platform's standard service tiers.
 * Handles can be replaced or withdrawn at runtime.
 */
@Slf4j
@Service
public class DefaultServiceCatalog implements ServiceCatalog {

    private static final BigInteger ONE_POINT = BigInteger.TEN.pow(18);
    private static final long THIRTY_DAYS = TimeUnit.DAYS.toSeconds(30);

    @Value("${ledger.catalog.enabled:true}")
    private boolean enabled;

    private final Map<ServiceType, ServiceCatalogHandle> handles = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        resetToDefaults();
        log.info("Service catalog initialized: enabled={}, serviceTypes={}", enabled, handles.keySet());
    }

    @Override
    public Optional<ServiceCatalogHandle> resolve(ServiceType serviceType) {
        if (!enabled || serviceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handles.get(serviceType));
    }

    public void register(ServiceCatalogHandle handle) {
        handles.put(handle.getServiceType(), handle);
        log.info("Registered catalog handle: serviceType={}", handle.getServiceType());
    }

    public void unregister(ServiceType serviceType) {
        handles.remove(serviceType);
        log.info("Unregistered catalog handle: serviceType={}", serviceType);
    }

    public void resetToDefaults() {
        handles.clear();
        for (ServiceCatalogHandle handle : defaultHandles()) {
            handles.put(handle.getServiceType(), handle);
        }
    }

    private static ServiceCatalogHandle[] defaultHandles() {
        return new ServiceCatalogHandle[] {
            StaticServiceCatalogHandle.builder(ServiceType.ADVANCED_ANALYTICS)
                    .cooldownSeconds(TimeUnit.DAYS.toSeconds(1))
                    .level(ServiceLevel.BASIC, points(100), THIRTY_DAYS, "Basic data analysis report with market trends")
                    .level(ServiceLevel.STANDARD, points(500), THIRTY_DAYS, "In-depth portfolio analysis report")
                    .level(ServiceLevel.PREMIUM, points(1000), THIRTY_DAYS, "Professional investment advice report")
                    .level(ServiceLevel.VIP, points(2000), THIRTY_DAYS, "Custom research report with one-on-one consulting")
                    .build(),
            StaticServiceCatalogHandle.builder(ServiceType.PRIORITY_SERVICE)
                    .cooldownSeconds(TimeUnit.HOURS.toSeconds(12))
                    .level(ServiceLevel.BASIC, points(200), THIRTY_DAYS, "Priority loan processing (24h)")
                    .level(ServiceLevel.STANDARD, points(500), THIRTY_DAYS, "Priority loan processing (12h)")
                    .level(ServiceLevel.PREMIUM, points(1000), THIRTY_DAYS, "Dedicated customer support")
                    .level(ServiceLevel.VIP, points(2000), THIRTY_DAYS, "VIP exclusive manager service")
                    .build(),
            StaticServiceCatalogHandle.builder(ServiceType.FEATURE_UNLOCK)
                    .cooldownSeconds(TimeUnit.DAYS.toSeconds(7))
                    .level(ServiceLevel.BASIC, points(200), THIRTY_DAYS, "Custom interest rate calculator")
                    .level(ServiceLevel.STANDARD, points(800), THIRTY_DAYS, "Batch operation tools")
                    .level(ServiceLevel.PREMIUM, points(1500), THIRTY_DAYS, "Advanced risk management tools")
                    .level(ServiceLevel.VIP, points(3000), THIRTY_DAYS, "Full feature unlock")
                    .build(),
            StaticServiceCatalogHandle.builder(ServiceType.GOVERNANCE_ACCESS)
                    .cooldownSeconds(TimeUnit.DAYS.toSeconds(30))
                    .level(ServiceLevel.BASIC, points(200), THIRTY_DAYS, "Basic voting rights")
                    .level(ServiceLevel.STANDARD, points(1000), THIRTY_DAYS, "Proposal creation rights")
                    .level(ServiceLevel.PREMIUM, points(2500), THIRTY_DAYS, "Parameter adjustment suggestions")
                    .level(ServiceLevel.VIP, points(6000), THIRTY_DAYS, "Core governance participation")
                    .build(),
            StaticServiceCatalogHandle.builder(ServiceType.TESTNET_FEATURES)
                    .cooldownSeconds(TimeUnit.HOURS.toSeconds(1))
                    .level(ServiceLevel.BASIC, points(50), THIRTY_DAYS, "Testnet feature preview")
                    .level(ServiceLevel.STANDARD, points(150), THIRTY_DAYS, "Testnet early access")
                    .level(ServiceLevel.PREMIUM, points(300), THIRTY_DAYS, "Testnet beta programme")
                    .level(ServiceLevel.VIP, points(600), THIRTY_DAYS, "Testnet developer sandbox")
                    .build()
        };
    }

    private static BigInteger points(long wholePoints) {
        return BigInteger.valueOf(wholePoints).multiply(ONE_POINT);
    }
}
