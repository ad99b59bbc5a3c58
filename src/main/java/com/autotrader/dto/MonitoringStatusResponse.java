package com.autotrader.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MonitoringStatusResponse {

    private boolean running;
    private boolean tickInProgress;
    private long tickIntervalMs;
    private long completedTicks;
    private long skippedTicks;
    private Instant lastTickStartedAt;
    private long lastTickDurationMs;
    private int openPositions;
    private int positionsAwaitingIntervention;
}
