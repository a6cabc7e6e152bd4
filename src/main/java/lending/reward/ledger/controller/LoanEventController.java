package lending.reward.ledger.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lending.reward.ledger.dto.AccrualResult;
import lending.reward.ledger.dto.ApiResponse;
import lending.reward.ledger.dto.BatchLoanEventRequest;
import lending.reward.ledger.dto.LoanEventRequest;
import lending.reward.ledger.dto.OrderLoanEventRequest;
import lending.reward.ledger.dto.PenaltyRequest;
import lending.reward.ledger.service.AccrualEngineService;
import lending.reward.ledger.service.auth.CallerContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Entry points for the lending engine and the liquidation subsystem
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/loan-events")
@Validated
@Tag(name = "Loan Events", description = "Accrual of points from loan lifecycle events")
public class LoanEventController {

    @Autowired
    private AccrualEngineService accrualEngine;

    @PostMapping
    @Operation(summary = "Deliver an aggregate loan event",
               description = "Positive term locks a point for an eligible borrow; zero term settles the user's lock")
    public ApiResponse<AccrualResult> onLoanEvent(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @Valid @RequestBody LoanEventRequest request) {
        log.info("Loan event: userId={}, principal={}, termSeconds={}, onTimeAndFull={}",
                request.getUserId(), request.getPrincipal(), request.getTermSeconds(), request.isOnTimeAndFull());
        AccrualResult result = accrualEngine.onLoanEvent(CallerContext.of(callerId), request.getUserId(),
                request.getPrincipal(), request.getTermSeconds(), request.isOnTimeAndFull());
        return ApiResponse.success(result);
    }

    @PostMapping("/orders")
    @Operation(summary = "Deliver a per-order loan event",
               description = "Idempotent: duplicate borrows and repeated repayments are ignored")
    public ApiResponse<AccrualResult> onOrderEvent(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @Valid @RequestBody OrderLoanEventRequest request) {
        log.info("Order loan event: userId={}, orderId={}, outcome={}",
                request.getUserId(), request.getOrderId(), request.getOutcome());
        AccrualResult result = accrualEngine.onLoanEventV2(CallerContext.of(callerId), request.getUserId(),
                request.getOrderId(), request.getPrincipal(), request.getMaturity(), request.getOutcome());
        return ApiResponse.success(result);
    }

    @PostMapping("/batch")
    @Operation(summary = "Deliver a batch of aggregate loan events", description = "At most 100 items, applied atomically")
    public ApiResponse<List<AccrualResult>> onBatch(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @RequestBody BatchLoanEventRequest request) {
        List<AccrualResult> results = accrualEngine.onBatchLoanEvents(CallerContext.of(callerId),
                request.getUserIds(), request.getPrincipals(), request.getTermSeconds(), request.getOutcomes());
        return ApiResponse.success(results);
    }

    @PostMapping("/penalties")
    @Operation(summary = "Deduct points", description = "Burns what the balance covers, the rest becomes debt")
    public ApiResponse<AccrualResult> deductPoints(
            @RequestHeader(CallerHeaders.CALLER_ID) String callerId,
            @Valid @RequestBody PenaltyRequest request) {
        log.info("Penalty request: userId={}, amount={}", request.getUserId(), request.getAmount());
        AccrualResult result = accrualEngine.deductPoints(CallerContext.of(callerId),
                request.getUserId(), request.getAmount());
        return ApiResponse.success(result);
    }
}
