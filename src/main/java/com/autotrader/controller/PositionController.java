package com.autotrader.controller;

import com.autotrader.dto.ApiResponse;
import com.autotrader.dto.ClosePositionRequest;
import com.autotrader.dto.CreatePositionRequest;
import com.autotrader.entity.AlertHistoryEntity;
import com.autotrader.exception.ResourceNotFoundException;
import com.autotrader.exception.TradeExecutionException;
import com.autotrader.gateway.PriceOracle;
import com.autotrader.model.ActionOutcome;
import com.autotrader.model.ActionResult;
import com.autotrader.model.ExitReason;
import com.autotrader.model.Position;
import com.autotrader.service.persistence.AlertHistoryService;
import com.autotrader.service.position.CreatePositionCommand;
import com.autotrader.service.position.PositionManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/positions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Positions", description = "Position registration, inspection and manual override")
public class PositionController {

    private final PositionManager positionManager;
    private final PriceOracle priceOracle;
    private final AlertHistoryService alertHistoryService;

    @PostMapping
    @Operation(summary = "Register a position",
               description = "Register a completed buy for monitoring. Exit rules default to the trading.* configuration")
    public ResponseEntity<ApiResponse<Position>> createPosition(@Valid @RequestBody CreatePositionRequest request) {
        log.info("Create position request: token={}, entry={}, amount={}",
                request.getTokenId(), request.getEntryPrice(), request.getAmount());
        Position position = positionManager.createPosition(CreatePositionCommand.builder()
                .tokenId(request.getTokenId())
                .tokenSymbol(request.getTokenSymbol())
                .strategyId(request.getStrategyId())
                .entryPrice(request.getEntryPrice())
                .amount(request.getAmount())
                .budgetQuote(request.getBudgetQuote())
                .exitRules(request.getExitRules())
                .scaleInPlan(request.getScaleInPlan())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Position created", position));
    }

    @GetMapping
    @Operation(summary = "List open positions", description = "All OPEN and PARTIALLY_CLOSED positions, oldest first")
    public ResponseEntity<ApiResponse<List<Position>>> getOpenPositions() {
        return ResponseEntity.ok(ApiResponse.success(positionManager.getOpenPositions()));
    }

    @GetMapping("/{positionId}")
    @Operation(summary = "Get a position by id", description = "Open positions from memory, closed ones from storage")
    public ResponseEntity<ApiResponse<Position>> getPosition(@PathVariable String positionId) {
        Position position = positionManager.getPosition(positionId)
                .orElseThrow(() -> new ResourceNotFoundException("Position not found: " + positionId));
        return ResponseEntity.ok(ApiResponse.success(position));
    }

    @PostMapping("/{positionId}/close")
    @Operation(summary = "Close a position",
               description = "Manual override: sell everything that remains. Uses the current price when none is given")
    public ResponseEntity<ApiResponse<Position>> closePosition(@PathVariable String positionId,
                                                               @Valid @RequestBody(required = false) ClosePositionRequest request) {
        Position position = positionManager.getPosition(positionId)
                .orElseThrow(() -> new ResourceNotFoundException("Position not found: " + positionId));
        double exitPrice = request != null && request.getExitPrice() != null
                ? request.getExitPrice()
                : priceOracle.getPrice(position.getTokenId());
        ExitReason reason = request != null && request.getReason() != null ? request.getReason() : ExitReason.MANUAL;

        log.info("Manual close request: position={}, price={}, reason={}", positionId, exitPrice, reason);
        ActionResult result = positionManager.applyFullClose(positionId, exitPrice, reason);
        if (result.getOutcome() == ActionOutcome.FAILED || result.getOutcome() == ActionOutcome.ABANDONED) {
            throw new TradeExecutionException(TradeExecutionException.Side.SELL,
                    "Close of position " + positionId + " failed: " + result.getMessage());
        }
        String message = result.isApplied() ? "Position closed" : result.getMessage();
        return ResponseEntity.ok(ApiResponse.success(message, result.getPosition()));
    }

    @PostMapping("/{positionId}/resume")
    @Operation(summary = "Resume monitoring",
               description = "Clear the manual-intervention flag after retries were exhausted")
    public ResponseEntity<ApiResponse<Position>> resumeMonitoring(@PathVariable String positionId) {
        return ResponseEntity.ok(ApiResponse.success("Monitoring resumed", positionManager.resumeMonitoring(positionId)));
    }

    @GetMapping("/{positionId}/alerts")
    @Operation(summary = "Alert history of a position")
    public ResponseEntity<ApiResponse<List<AlertHistoryEntity>>> getAlerts(@PathVariable String positionId) {
        return ResponseEntity.ok(ApiResponse.success(alertHistoryService.getAlertsForPosition(positionId)));
    }
}
