package lending.reward.ledger.service;

import lending.reward.ledger.domain.UserAccount;
import lending.reward.ledger.service.telemetry.TelemetryPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("Debt Ledger Service Tests")
class DebtLedgerServiceTest {

    @Mock
    private TelemetryPublisher telemetry;

    @InjectMocks
    private DebtLedgerService debtLedger;

    private static UserAccount withDebt(long debt) {
        UserAccount account = UserAccount.newAccount(1L);
        account.setDebt(BigInteger.valueOf(debt));
        return account;
    }

    @Test
    @DisplayName("Debt 30, release 100: mint 70, debt cleared")
    void testOffset_DebtSmallerThanRelease() {
        UserAccount account = withDebt(30);

        BigInteger mintable = debtLedger.offsetRelease(account, BigInteger.valueOf(100));

        assertThat(mintable).isEqualTo(BigInteger.valueOf(70));
        assertThat(account.getDebt()).isZero();
        verify(telemetry).debtChanged(1L, BigInteger.ZERO);
    }

    @Test
    @DisplayName("Debt 130, release 100: mint nothing, 30 still owed")
    void testOffset_DebtLargerThanRelease() {
        UserAccount account = withDebt(130);

        BigInteger mintable = debtLedger.offsetRelease(account, BigInteger.valueOf(100));

        assertThat(mintable).isZero();
        assertThat(account.getDebt()).isEqualTo(BigInteger.valueOf(30));
    }

    @Test
    @DisplayName("Without debt the whole release is mintable and nothing is emitted")
    void testOffset_NoDebt() {
        UserAccount account = withDebt(0);

        assertThat(debtLedger.offsetRelease(account, BigInteger.valueOf(100))).isEqualTo(BigInteger.valueOf(100));
        verify(telemetry, never()).debtChanged(anyLong(), any());
    }

    @Test
    @DisplayName("Shortfall adds to debt, zero shortfall is ignored")
    void testRecordShortfall() {
        UserAccount account = withDebt(5);

        debtLedger.recordShortfall(account, BigInteger.valueOf(7));
        debtLedger.recordShortfall(account, BigInteger.ZERO);

        assertThat(account.getDebt()).isEqualTo(BigInteger.valueOf(12));
        verify(telemetry).debtChanged(1L, BigInteger.valueOf(12));
    }
}
