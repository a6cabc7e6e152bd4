package lending.reward.ledger.service;

import lending.reward.ledger.domain.TierThreshold;
import lending.reward.ledger.domain.UserAccount;
import lending.reward.ledger.enums.LedgerAction;
import lending.reward.ledger.service.auth.AuthorizationService;
import lending.reward.ledger.service.auth.CallerContext;
import lending.reward.ledger.service.lock.LedgerMutationExecutor;
import lending.reward.ledger.service.telemetry.TelemetryPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Derives user levels from lifetime activity.
 *
 * Promotion starts at the level above the current one and climbs while each next level's
 * thresholds are all met, so one evaluation can move several levels. Levels never go down
 * except through an explicit override.
 */
@Slf4j
@Service
public class TierService {

    private static final BigInteger USDC = BigInteger.TEN.pow(6);

    static final List<TierThreshold> THRESHOLDS = List.of(
            new TierThreshold(2, usdc(10_000), 3, 1),
            new TierThreshold(3, usdc(50_000), 10, 5),
            new TierThreshold(4, usdc(200_000), 25, 15),
            new TierThreshold(5, usdc(1_000_000), 50, 40));

    @Autowired
    private AuthorizationService authorizationService;

    @Autowired
    private LedgerMutationExecutor mutationExecutor;

    @Autowired
    private UserAccountService accountService;

    @Autowired
    private TelemetryPublisher telemetry;

    /**
     * Promote an account in place if its counters allow it
     *
     * @return true if the level changed
     */
    public boolean evaluatePromotion(UserAccount account) {
        int current = account.getUserLevel();
        int resolved = resolveLevel(account);
        if (resolved == current) {
            return false;
        }

        account.setUserLevel(resolved);
        log.info("User promoted: userId={}, fromLevel={}, toLevel={}", account.getUserId(), current, resolved);
        telemetry.levelChanged(account.getUserId(), resolved);
        return true;
    }

    /**
     * Highest level reachable from the current one through contiguous satisfied thresholds
     */
    public static int resolveLevel(UserAccount account) {
        int level = account.getUserLevel();
        for (TierThreshold threshold : THRESHOLDS) {
            if (threshold.getLevel() <= level) {
                continue;
            }
            if (threshold.getLevel() != level + 1 || !threshold.isSatisfiedBy(account)) {
                break;
            }
            level = threshold.getLevel();
        }
        return level;
    }

    /**
     * Administrative override, may set any level 1..5 including a lower one
     */
    public UserAccount updateUserLevel(CallerContext caller, Long userId, int level) {
        authorizationService.requireRole(LedgerAction.SET_PARAMETER, caller);
        UserAccountService.requireUserId(userId);
        RewardParameterService.requireLevel(level);

        return mutationExecutor.execute("updateUserLevel", () -> {
            UserAccount account = accountService.loadOrCreate(userId);
            int previous = account.getUserLevel();
            account.setUserLevel(level);
            accountService.save(account);

            log.info("User level overridden: userId={}, fromLevel={}, toLevel={}, caller={}",
                    userId, previous, level, caller.getCallerId());
            if (previous != level) {
                telemetry.levelChanged(userId, level);
            }
            return account;
        });
    }

    private static BigInteger usdc(long whole) {
        return BigInteger.valueOf(whole).multiply(USDC);
    }
}
