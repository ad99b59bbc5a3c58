package com.autotrader.controller;

import com.autotrader.dto.ApiResponse;
import com.autotrader.dto.OpenStrategyPositionRequest;
import com.autotrader.dto.PerformanceStatsResponse;
import com.autotrader.dto.StrategyRequest;
import com.autotrader.model.Position;
import com.autotrader.model.Strategy;
import com.autotrader.service.position.PositionManager;
import com.autotrader.service.strategy.AutoTraderService;
import com.autotrader.service.strategy.StrategyService;
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
@RequestMapping("/api/strategies")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Strategies", description = "Strategy templates, budget limits and strategy-sized entries")
public class StrategyController {

    private final StrategyService strategyService;
    private final AutoTraderService autoTraderService;
    private final PositionManager positionManager;

    @PostMapping
    @Operation(summary = "Create a strategy",
               description = "Defaults: 3 concurrent positions, max position size 0.1, total budget 1.0")
    public ResponseEntity<ApiResponse<Strategy>> createStrategy(@Valid @RequestBody StrategyRequest request) {
        log.info("Create strategy request: name={}", request.getName());
        Strategy strategy = strategyService.createStrategy(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Strategy created", strategy));
    }

    @GetMapping
    @Operation(summary = "List strategies")
    public ResponseEntity<ApiResponse<List<Strategy>>> listStrategies() {
        return ResponseEntity.ok(ApiResponse.success(strategyService.listStrategies()));
    }

    @GetMapping("/stats")
    @Operation(summary = "Aggregate performance statistics", description = "Trade counts, win rate and realised profit")
    public ResponseEntity<ApiResponse<PerformanceStatsResponse>> getPerformanceStats() {
        return ResponseEntity.ok(ApiResponse.success(strategyService.getPerformanceStats()));
    }

    @GetMapping("/{strategyId}")
    @Operation(summary = "Get a strategy by id")
    public ResponseEntity<ApiResponse<Strategy>> getStrategy(@PathVariable String strategyId) {
        return ResponseEntity.ok(ApiResponse.success(strategyService.getStrategy(strategyId)));
    }

    @PutMapping("/{strategyId}")
    @Operation(summary = "Update a strategy", description = "Omitted fields keep their current value")
    public ResponseEntity<ApiResponse<Strategy>> updateStrategy(@PathVariable String strategyId,
                                                                @Valid @RequestBody StrategyRequest request) {
        return ResponseEntity.ok(ApiResponse.success("Strategy updated", strategyService.updateStrategy(strategyId, request)));
    }

    @DeleteMapping("/{strategyId}")
    @Operation(summary = "Delete a strategy", description = "Open positions of the strategy stay under monitoring")
    public ResponseEntity<ApiResponse<Void>> deleteStrategy(@PathVariable String strategyId) {
        strategyService.deleteStrategy(strategyId);
        return ResponseEntity.ok(ApiResponse.success("Strategy deleted", null));
    }

    @PostMapping("/{strategyId}/enable")
    @Operation(summary = "Enable a strategy")
    public ResponseEntity<ApiResponse<Strategy>> enableStrategy(@PathVariable String strategyId) {
        return ResponseEntity.ok(ApiResponse.success(strategyService.setEnabled(strategyId, true)));
    }

    @PostMapping("/{strategyId}/disable")
    @Operation(summary = "Disable a strategy", description = "Blocks new entries; open positions stay under monitoring")
    public ResponseEntity<ApiResponse<Strategy>> disableStrategy(@PathVariable String strategyId) {
        return ResponseEntity.ok(ApiResponse.success(strategyService.setEnabled(strategyId, false)));
    }

    @PostMapping("/{strategyId}/positions")
    @Operation(summary = "Open a strategy-sized position",
               description = "Checks position count and remaining budget, buys the initial fraction and registers the position")
    public ResponseEntity<ApiResponse<Position>> openPosition(@PathVariable String strategyId,
                                                              @Valid @RequestBody OpenStrategyPositionRequest request) {
        log.info("Open position request: strategy={}, token={}", strategyId, request.getTokenId());
        Position position = autoTraderService.openPosition(strategyId, request.getTokenId(), request.getTokenSymbol());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Position opened", position));
    }

    @GetMapping("/{strategyId}/positions")
    @Operation(summary = "Positions of a strategy", description = "Open and closed, newest first")
    public ResponseEntity<ApiResponse<List<Position>>> getStrategyPositions(@PathVariable String strategyId) {
        strategyService.getStrategy(strategyId);
        return ResponseEntity.ok(ApiResponse.success(positionManager.getPositionsByStrategy(strategyId)));
    }
}
