package com.autotrader.controller;

import com.autotrader.dto.ApiResponse;
import com.autotrader.dto.MonitoringStatusResponse;
import com.autotrader.entity.AlertHistoryEntity;
import com.autotrader.service.monitoring.PositionMonitoringService;
import com.autotrader.service.persistence.AlertHistoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Position Monitoring", description = "Monitoring loop control and alert history")
public class MonitoringController {

    private final PositionMonitoringService monitoringService;
    private final AlertHistoryService alertHistoryService;

    @GetMapping("/status")
    @Operation(summary = "Monitoring loop status", description = "Tick counters, timings and open position counts")
    public ResponseEntity<ApiResponse<MonitoringStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(monitoringService.getStatus()));
    }

    @PostMapping("/start")
    @Operation(summary = "Start the monitoring loop")
    public ResponseEntity<ApiResponse<MonitoringStatusResponse>> start() {
        boolean started = monitoringService.start();
        log.info("Monitoring start requested: started={}", started);
        return ResponseEntity.ok(ApiResponse.success(started ? "Monitoring started" : "Monitoring already running",
                monitoringService.getStatus()));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop the monitoring loop", description = "In-flight actions complete; no new ticks are started")
    public ResponseEntity<ApiResponse<MonitoringStatusResponse>> stop() {
        boolean stopped = monitoringService.stop();
        log.info("Monitoring stop requested: stopped={}", stopped);
        return ResponseEntity.ok(ApiResponse.success(stopped ? "Monitoring stopped" : "Monitoring not running",
                monitoringService.getStatus()));
    }

    @PostMapping("/tick")
    @Operation(summary = "Run one tick now", description = "Skipped if a tick is already in progress")
    public ResponseEntity<ApiResponse<MonitoringStatusResponse>> tick() {
        boolean ran = monitoringService.tickOnce();
        return ResponseEntity.ok(ApiResponse.success(ran ? "Tick completed" : "Tick skipped, another tick in progress",
                monitoringService.getStatus()));
    }

    @GetMapping("/alerts")
    @Operation(summary = "Recent alerts", description = "Last 100 alerts, newest first")
    public ResponseEntity<ApiResponse<List<AlertHistoryEntity>>> getRecentAlerts() {
        return ResponseEntity.ok(ApiResponse.success(alertHistoryService.getRecentAlerts()));
    }
}
