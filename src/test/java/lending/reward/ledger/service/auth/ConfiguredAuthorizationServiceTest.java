package lending.reward.ledger.service.auth;

import lending.reward.ledger.config.AuthorizationProperties;
import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.exception.UnauthorizedCallerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Configured Authorization Service Tests")
class ConfiguredAuthorizationServiceTest {

    private ConfiguredAuthorizationService authorizationService;

    @BeforeEach
    void setUp() {
        AuthorizationProperties properties = new AuthorizationProperties();
        properties.getRoles().put(LedgerAction.DELIVER_LOAN_EVENT, Set.of("lending-engine"));
        properties.getRoles().put(LedgerAction.MINT_BURN, Set.of("accrual-engine", "consumption-engine"));

        authorizationService = new ConfiguredAuthorizationService();
        ReflectionTestUtils.setField(authorizationService, "properties", properties);
    }

    @Test
    @DisplayName("Configured caller holds its role only")
    void testHasRole() {
        CallerContext lendingEngine = CallerContext.of("lending-engine");

        assertThat(authorizationService.hasRole(LedgerAction.DELIVER_LOAN_EVENT, lendingEngine)).isTrue();
        assertThat(authorizationService.hasRole(LedgerAction.MINT_BURN, lendingEngine)).isFalse();
        assertThat(authorizationService.hasRole(LedgerAction.MINT_BURN, CallerContext.of("consumption-engine")))
                .isTrue();
    }

    @Test
    @DisplayName("Action without holders, null caller and blank identity are refused")
    void testNoHolders() {
        assertThat(authorizationService.hasRole(LedgerAction.SET_PARAMETER, CallerContext.of("ledger-admin")))
                .isFalse();
        assertThat(authorizationService.hasRole(LedgerAction.DELIVER_LOAN_EVENT, null)).isFalse();
        assertThat(authorizationService.hasRole(LedgerAction.DELIVER_LOAN_EVENT, CallerContext.of(null))).isFalse();
    }

    @Test
    @DisplayName("requireRole throws for a caller without the role")
    void testRequireRole() {
        assertThatCode(() -> authorizationService.requireRole(LedgerAction.DELIVER_LOAN_EVENT,
                CallerContext.of("lending-engine")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> authorizationService.requireRole(LedgerAction.DELIVER_LOAN_EVENT,
                CallerContext.of("intruder")))
                .isInstanceOf(UnauthorizedCallerException.class)
                .hasMessageContaining("intruder");
    }
}
