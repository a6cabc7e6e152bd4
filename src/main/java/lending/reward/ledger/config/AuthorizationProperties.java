package lending.reward.ledger.config;

import lending.reward.ledger.enums.LedgerAction;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Caller identities granted each ledger action, bound from ledger.auth.roles.&lt;ACTION&gt;
 */
@Data
@ConfigurationProperties(prefix = "ledger.auth")
public class AuthorizationProperties {

    private Map<LedgerAction, Set<String>> roles = new EnumMap<>(LedgerAction.class);
}
