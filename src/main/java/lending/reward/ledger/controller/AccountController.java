package lending.reward.ledger.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotNull;
import lending.reward.ledger.domain.ConsumptionRecord;
import lending.reward.ledger.domain.OrderLock;
import lending.reward.ledger.domain.UserAccount;
import lending.reward.ledger.dto.ApiResponse;
import lending.reward.ledger.dto.PrivilegeResponse;
import lending.reward.ledger.dto.UserAccountResponse;
import lending.reward.ledger.enums.ServiceType;
import lending.reward.ledger.service.AccrualEngineService;
import lending.reward.ledger.service.ConsumptionEngineService;
import lending.reward.ledger.service.DebtLedgerService;
import lending.reward.ledger.service.PrivilegeService;
import lending.reward.ledger.service.RewardParameterService;
import lending.reward.ledger.service.UserAccountService;
import lending.reward.ledger.service.balance.PointsBalanceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only views of a user's ledger state
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/accounts")
@Validated
@Tag(name = "Accounts", description = "Balances, debt, locks, privileges and history")
public class AccountController {

    @Autowired
    private UserAccountService accountService;

    @Autowired
    private PointsBalanceService pointsBalance;

    @Autowired
    private DebtLedgerService debtLedger;

    @Autowired
    private RewardParameterService parameterService;

    @Autowired
    private PrivilegeService privilegeService;

    @Autowired
    private ConsumptionEngineService consumptionEngine;

    @Autowired
    private AccrualEngineService accrualEngine;

    @GetMapping("/{userId}")
    @Operation(summary = "Get user account")
    public ApiResponse<UserAccountResponse> getAccount(
            @Parameter(description = "User ID", required = true) @PathVariable @NotNull Long userId) {
        UserAccount account = accountService.getAccount(userId);
        UserAccountResponse response = UserAccountResponse.fromAccount(account,
                pointsBalance.balanceOf(userId),
                accountService.getOrderLockedPoints(userId),
                parameterService.getLevelMultiplier(account.getUserLevel()));
        return ApiResponse.success(response);
    }

    @GetMapping("/{userId}/balance")
    @Operation(summary = "Get spendable points")
    public ApiResponse<BigInteger> getBalance(@PathVariable @NotNull Long userId) {
        return ApiResponse.success(pointsBalance.balanceOf(userId));
    }

    @GetMapping("/{userId}/debt")
    @Operation(summary = "Get outstanding penalty debt")
    public ApiResponse<BigInteger> getDebt(@PathVariable @NotNull Long userId) {
        return ApiResponse.success(debtLedger.getPenaltyDebt(userId));
    }

    @GetMapping("/{userId}/privileges")
    @Operation(summary = "Get active service privileges", description = "Unpacked and packed forms")
    public ApiResponse<PrivilegeResponse> getPrivileges(@PathVariable @NotNull Long userId) {
        return ApiResponse.success(PrivilegeResponse.fromPrivilege(privilegeService.getUserPrivilege(userId)));
    }

    @GetMapping("/{userId}/consumptions")
    @Operation(summary = "Get consumption history")
    public ApiResponse<List<ConsumptionRecord>> getConsumptions(@PathVariable @NotNull Long userId) {
        return ApiResponse.success(consumptionEngine.getUserConsumptions(userId));
    }

    @GetMapping("/{userId}/cooldowns/{serviceType}")
    @Operation(summary = "Get remaining cooldown in seconds")
    public ApiResponse<Long> getCooldown(@PathVariable @NotNull Long userId,
                                         @PathVariable @NotNull ServiceType serviceType) {
        return ApiResponse.success(consumptionEngine.getServiceCooldownRemaining(userId, serviceType));
    }

    @GetMapping("/{userId}/orders")
    @Operation(summary = "Get live per-order locks")
    public ApiResponse<List<OrderLock>> getOrderLocks(@PathVariable @NotNull Long userId) {
        return ApiResponse.success(accrualEngine.getOrderLocks(userId));
    }

    @GetMapping("/orders/{orderId}")
    @Operation(summary = "Get the lock held for an order", description = "data is null once the order is settled")
    public ApiResponse<OrderLock> getOrderLock(@PathVariable @NotNull Long orderId) {
        return ApiResponse.success(accrualEngine.getOrderLock(orderId));
    }
}
