package lending.reward.ledger.service.catalog;

import lending.reward.ledger.enums.ServiceType;

import java.util.Optional;

/**
 * Locator for the pricing and cooldown of each service type
 */
public interface ServiceCatalog {

    /**
     * Handle for a service type, empty when the catalog cannot serve it
     */
    Optional<ServiceCatalogHandle> resolve(ServiceType serviceType);
}
