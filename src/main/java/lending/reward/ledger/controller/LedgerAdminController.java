package lending.reward.ledger.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lending.reward.ledger.domain.LedgerStatistics;
import lending.reward.ledger.domain.RewardParameters;
import lending.reward.ledger.domain.UserAccount;
import lending.reward.ledger.dto.ApiResponse;
import lending.reward.ledger.dto.DynamicRewardRequest;
import lending.reward.ledger.dto.PenaltyBpsRequest;
import lending.reward.ledger.dto.PointsEstimate;
import lending.reward.ledger.dto.RewardParametersRequest;
import lending.reward.ledger.service.LedgerStatisticsService;
import lending.reward.ledger.service.PointsEstimatorService;
import lending.reward.ledger.service.RewardParameterService;
import lending.reward.ledger.service.TierService;
import lending.reward.ledger.service.auth.CallerContext;
import lending.reward.ledger.service.lock.LedgerLockService;
import lending.reward.ledger.service.telemetry.TelemetryDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Administrative parameters, level overrides, statistics and reward estimates
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Ledger Administration", description = "Parameter setters require the SET_PARAMETER role")
public class LedgerAdminController {

    @Autowired
    private RewardParameterService parameterService;

    @Autowired
    private TierService tierService;

    @Autowired
    private PointsEstimatorService estimatorService;

    @Autowired
    private LedgerStatisticsService statisticsService;

    @Autowired
    private LedgerLockService lockService;

    @Autowired
    private TelemetryDispatcher telemetryDispatcher;

    @GetMapping("/admin/parameters")
    @Operation(summary = "Get reward parameters")
    public ApiResponse<RewardParameters> getParameters() {
        return ApiResponse.success(parameterService.getParameters());
    }

    @PutMapping("/admin/parameters")
    @Operation(summary = "Update core reward parameters")
    public ApiResponse<RewardParameters> updateParameters(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @Valid @RequestBody RewardParametersRequest request) {
        RewardParameters updated = parameterService.updateRewardParameters(CallerContext.of(callerId),
                request.getBaseUsd(), request.getPerDay(), request.getBonusBps(), request.getDynamicThreshold());
        return ApiResponse.success("Parameters updated", updated);
    }

    @PutMapping("/admin/health-factor-bonus")
    @Operation(summary = "Set health factor bonus (bps)")
    public ApiResponse<RewardParameters> setHealthFactorBonus(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestParam int bps) {
        return ApiResponse.success(parameterService.setHealthFactorBonus(CallerContext.of(callerId), bps));
    }

    @PutMapping("/admin/dynamic-reward")
    @Operation(summary = "Set dynamic reward threshold and multiplier")
    public ApiResponse<RewardParameters> setDynamicReward(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @Valid @RequestBody DynamicRewardRequest request) {
        return ApiResponse.success(parameterService.setDynamicRewardParameters(CallerContext.of(callerId),
                request.getThreshold(), request.getMultiplierBps()));
    }

    @PutMapping("/admin/cache-expiry")
    @Operation(summary = "Set estimate cache expiry (seconds)")
    public ApiResponse<RewardParameters> setCacheExpiry(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestParam long seconds) {
        return ApiResponse.success(parameterService.setCacheExpiry(CallerContext.of(callerId), seconds));
    }

    @PutMapping("/admin/on-time-window")
    @Operation(summary = "Set on-time window half-width (seconds)")
    public ApiResponse<RewardParameters> setOnTimeWindow(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestParam long seconds) {
        return ApiResponse.success(parameterService.setOnTimeWindow(CallerContext.of(callerId), seconds));
    }

    @PutMapping("/admin/penalty-bps")
    @Operation(summary = "Set early and late penalty (bps)")
    public ApiResponse<RewardParameters> setPenaltyBps(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @Valid @RequestBody PenaltyBpsRequest request) {
        return ApiResponse.success(parameterService.setPenaltyBps(CallerContext.of(callerId),
                request.getEarlyBps(), request.getLateBps()));
    }

    @PutMapping("/admin/upgrade-multiplier")
    @Operation(summary = "Set service upgrade cost multiplier (bps)")
    public ApiResponse<RewardParameters> setUpgradeMultiplier(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestParam int bps) {
        return ApiResponse.success(parameterService.setUpgradeMultiplier(CallerContext.of(callerId), bps));
    }

    @GetMapping("/admin/level-multipliers")
    @Operation(summary = "Get all level multipliers")
    public ApiResponse<Map<Integer, Integer>> getLevelMultipliers() {
        return ApiResponse.success(parameterService.getLevelMultipliers());
    }

    @GetMapping("/admin/level-multipliers/{level}")
    @Operation(summary = "Get level multiplier")
    public ApiResponse<Integer> getLevelMultiplier(@PathVariable int level) {
        return ApiResponse.success(parameterService.getLevelMultiplier(level));
    }

    @PutMapping("/admin/level-multipliers/{level}")
    @Operation(summary = "Set level multiplier (bps)")
    public ApiResponse<Integer> setLevelMultiplier(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @PathVariable int level,
            @RequestParam int bps) {
        parameterService.setLevelMultiplier(CallerContext.of(callerId), level, bps);
        return ApiResponse.success(parameterService.getLevelMultiplier(level));
    }

    @PutMapping("/admin/users/{userId}/level")
    @Operation(summary = "Override user level")
    public ApiResponse<Integer> updateUserLevel(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @PathVariable Long userId,
            @RequestParam int level) {
        UserAccount account = tierService.updateUserLevel(CallerContext.of(callerId), userId, level);
        return ApiResponse.success(account.getUserLevel());
    }

    @DeleteMapping("/admin/users/{userId}/estimate-cache")
    @Operation(summary = "Clear cached reward estimates of a user")
    public ApiResponse<Void> clearUserCache(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @PathVariable Long userId) {
        estimatorService.clearUserCache(CallerContext.of(callerId), userId);
        return ApiResponse.success("Cache cleared", null);
    }

    @GetMapping("/admin/statistics")
    @Operation(summary = "Get aggregate ledger statistics")
    public ApiResponse<LedgerStatistics> getStatistics() {
        return ApiResponse.success(statisticsService.getStatistics());
    }

    @GetMapping("/admin/runtime")
    @Operation(summary = "Get runtime state", description = "Lock mode, estimate cache stats and telemetry backlog")
    public ApiResponse<Map<String, Object>> getRuntimeState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("lock", lockService.getLockConfig());
        state.put("estimateCache", estimatorService.getCacheStats());
        state.put("telemetryDeadLetters", telemetryDispatcher.getDeadLetterCount());
        return ApiResponse.success(state);
    }

    @GetMapping("/estimates")
    @Operation(summary = "Preview the reward of a loan",
               description = "With userId the level and dynamic multipliers are applied and the result is cached")
    public ApiResponse<PointsEstimate> estimate(
            @RequestParam BigInteger principal,
            @RequestParam long durationSeconds,
            @RequestParam(defaultValue = "false") boolean healthFactorHighEnough,
            @RequestParam(required = false) Long userId) {
        PointsEstimate estimate = userId == null
                ? estimatorService.calculateExamplePoints(principal, durationSeconds, healthFactorHighEnough)
                : estimatorService.estimateUserPoints(userId, principal, durationSeconds, healthFactorHighEnough);
        return ApiResponse.success(estimate);
    }
}
