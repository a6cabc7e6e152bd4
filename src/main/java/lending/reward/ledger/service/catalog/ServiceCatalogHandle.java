package lending.reward.ledger.service.catalog;

import lending.reward.ledger.domain.ServiceConfig;
import lending.reward.ledger.enums.ServiceLevel;
import lending.reward.ledger.enums.ServiceType;

/**
 * Read-only view of one service type in the catalog
 */
public interface ServiceCatalogHandle {

    ServiceType getServiceType();

    /**
     * Config for a level, or null if the level is not offered
     */
    ServiceConfig getConfig(ServiceLevel level);

    /**
     * Minimum seconds between two purchases of this service type by one user
     */
    long getCooldownSeconds();
}
