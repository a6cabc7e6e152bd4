package lending.reward.ledger.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lending.reward.ledger.domain.ConsumptionRecord;
import lending.reward.ledger.dto.ApiResponse;
import lending.reward.ledger.dto.BatchConsumeRequest;
import lending.reward.ledger.dto.BatchConsumptionResult;
import lending.reward.ledger.dto.ConsumeServiceRequest;
import lending.reward.ledger.service.ConsumptionEngineService;
import lending.reward.ledger.service.auth.CallerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Front door for spending points on services
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/consumption")
@Validated
@Tag(name = "Consumption", description = "Service purchases and upgrades")
public class ConsumptionController {

    @Autowired
    private ConsumptionEngineService consumptionEngine;

    @PostMapping
    @Operation(summary = "Purchase a service")
    public ApiResponse<ConsumptionRecord> consume(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @Valid @RequestBody ConsumeServiceRequest request) {
        log.info("Consume request: userId={}, serviceType={}, level={}",
                request.getUserId(), request.getServiceType(), request.getServiceLevel());
        ConsumptionRecord record = consumptionEngine.consumeService(CallerContext.of(callerId),
                request.getUserId(), request.getServiceType(), request.getServiceLevel());
        return ApiResponse.success("Service purchased", record);
    }

    @PostMapping("/upgrade")
    @Operation(summary = "Upgrade an active service", description = "serviceLevel is the target level")
    public ApiResponse<ConsumptionRecord> upgrade(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @Valid @RequestBody ConsumeServiceRequest request) {
        log.info("Upgrade request: userId={}, serviceType={}, newLevel={}",
                request.getUserId(), request.getServiceType(), request.getServiceLevel());
        ConsumptionRecord record = consumptionEngine.upgradeService(CallerContext.of(callerId),
                request.getUserId(), request.getServiceType(), request.getServiceLevel());
        return ApiResponse.success("Service upgraded", record);
    }

    @PostMapping("/batch")
    @Operation(summary = "Purchase services in batch", description = "All items succeed or none do")
    public ApiResponse<BatchConsumptionResult> batch(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody BatchConsumeRequest request) {
        BatchConsumptionResult result = consumptionEngine.batchConsumeServices(CallerContext.of(callerId),
                request.getUserIds(), request.getServiceTypes(), request.getServiceLevels());
        return ApiResponse.success(result);
    }
}
