package com.autotrader.service.monitoring;

import com.autotrader.config.MonitoringConfig;
import com.autotrader.dto.MonitoringStatusResponse;
import com.autotrader.exception.ConcurrencyViolationException;
import com.autotrader.exception.PriceUnavailableException;
import com.autotrader.gateway.PriceOracle;
import com.autotrader.model.ActionResult;
import com.autotrader.model.Position;
import com.autotrader.model.ScaleInPhase;
import com.autotrader.service.monitoring.exit.ExitAction;
import com.autotrader.service.monitoring.exit.ExitRuleEvaluator;
import com.autotrader.service.monitoring.scalein.ScaleInPlanner;
import com.autotrader.service.position.PositionManager;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the periodic evaluation of all open positions.
 *
 * <h2>Tick lifecycle</h2>
 * <ol>
 *   <li>The scheduler fires at a fixed rate. If the previous tick is still running the new one
 *       is skipped, never queued.</li>
 *   <li>Eligible positions (no pending action, no manual-intervention flag) are grouped by
 *       token so each token is priced once per tick.</li>
 *   <li>Tokens are processed concurrently on the monitoring executor; positions of the same
 *       token are processed one after another.</li>
 *   <li>Per position: record the price, ask the scale-in planner, then the exit evaluator,
 *       and apply at most one action.</li>
 * </ol>
 * Every exception is contained at the position boundary so that one position cannot abort
 * the tick for the others. A tick waits at most {@code tickTimeoutMs} for its tokens, so a
 * task dropped by a shut-down pool cannot wedge the driver.
 */
@Slf4j
@Service
public class PositionMonitoringService {

    private final PositionManager positionManager;
    private final PriceOracle priceOracle;
    private final ExitRuleEvaluator exitRuleEvaluator;
    private final ScaleInPlanner scaleInPlanner;
    private final MonitoringConfig config;
    private final TaskScheduler taskScheduler;
    private final Executor tickExecutor;
    private final Executor monitoringExecutor;
    private final Clock clock;

    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);
    private final AtomicLong completedTicks = new AtomicLong();
    private final AtomicLong skippedTicks = new AtomicLong();

    private volatile boolean running;
    private volatile ScheduledFuture<?> scheduledTicks;
    private volatile Instant lastTickStartedAt;
    private volatile long lastTickDurationMs;

    public PositionMonitoringService(PositionManager positionManager,
                                     PriceOracle priceOracle,
                                     ExitRuleEvaluator exitRuleEvaluator,
                                     ScaleInPlanner scaleInPlanner,
                                     MonitoringConfig config,
                                     @Qualifier("monitoringTaskScheduler") TaskScheduler taskScheduler,
                                     @Qualifier("tickExecutor") Executor tickExecutor,
                                     @Qualifier("monitoringExecutor") Executor monitoringExecutor,
                                     Clock clock) {
        this.positionManager = positionManager;
        this.priceOracle = priceOracle;
        this.exitRuleEvaluator = exitRuleEvaluator;
        this.scaleInPlanner = scaleInPlanner;
        this.config = config;
        this.taskScheduler = taskScheduler;
        this.tickExecutor = tickExecutor;
        this.monitoringExecutor = monitoringExecutor;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.isEnabled()) {
            start();
        } else {
            log.info("Position monitoring disabled by configuration");
        }
    }

    // ==================== LIFECYCLE ====================

    public synchronized boolean start() {
        if (running) {
            return false;
        }
        running = true;
        scheduledTicks = taskScheduler.scheduleAtFixedRate(this::tick, Duration.ofMillis(config.getTickIntervalMs()));
        log.info("Position monitoring started: interval={}ms, maxConcurrentChecks={}",
                config.getTickIntervalMs(), config.getMaxConcurrentChecks());
        return true;
    }

    @PreDestroy
    public synchronized boolean stop() {
        if (!running) {
            return false;
        }
        running = false;
        ScheduledFuture<?> future = scheduledTicks;
        if (future != null) {
            future.cancel(false);
        }
        scheduledTicks = null;
        log.info("Position monitoring stopped after {} ticks ({} skipped)", completedTicks.get(), skippedTicks.get());
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    // ==================== TICK DRIVER ====================

    /**
     * Scheduler entry point. Hands the tick to the tick executor so the scheduler thread
     * never blocks.
     */
    void tick() {
        if (!running) {
            return;
        }
        if (!tickInProgress.compareAndSet(false, true)) {
            long skipped = skippedTicks.incrementAndGet();
            log.warn("Previous tick still running, skipping this tick (skipped so far: {})", skipped);
            return;
        }
        try {
            tickExecutor.execute(() -> {
                try {
                    runTick();
                } finally {
                    tickInProgress.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            tickInProgress.set(false);
            skippedTicks.incrementAndGet();
            log.warn("Tick rejected by executor: {}", e.getMessage());
        }
    }

    /**
     * Runs one tick on the calling thread.
     *
     * @return false if a tick was already in progress and this one was skipped
     */
    public boolean tickOnce() {
        if (!tickInProgress.compareAndSet(false, true)) {
            skippedTicks.incrementAndGet();
            log.warn("Previous tick still running, skipping manual tick");
            return false;
        }
        try {
            runTick();
            return true;
        } finally {
            tickInProgress.set(false);
        }
    }

    private void runTick() {
        Instant started = clock.instant();
        lastTickStartedAt = started;
        try {
            List<Position> eligible = new ArrayList<>();
            for (Position position : positionManager.getOpenPositions()) {
                if (!position.hasPendingAction() && !position.isManualInterventionRequired()) {
                    eligible.add(position);
                }
            }
            if (eligible.isEmpty()) {
                log.debug("Tick: no eligible positions");
                return;
            }

            Map<String, List<String>> positionsByToken = new LinkedHashMap<>();
            for (Position position : eligible) {
                positionsByToken.computeIfAbsent(position.getTokenId(), k -> new ArrayList<>()).add(position.getId());
            }
            log.debug("Tick: {} positions across {} tokens", eligible.size(), positionsByToken.size());

            List<CompletableFuture<Void>> futures = new ArrayList<>(positionsByToken.size());
            for (Map.Entry<String, List<String>> entry : positionsByToken.entrySet()) {
                futures.add(CompletableFuture
                        .runAsync(() -> processToken(entry.getKey(), entry.getValue()), monitoringExecutor)
                        .exceptionally(ex -> {
                            log.error("Token {} processing failed: {}", entry.getKey(), ex.getMessage(), ex);
                            return null;
                        }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .orTimeout(config.getTickTimeoutMs(), TimeUnit.MILLISECONDS)
                    .join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof TimeoutException) {
                log.warn("Tick did not finish within {}ms, abandoning the wait", config.getTickTimeoutMs());
            } else {
                log.error("Tick failed: {}", e.getMessage(), e);
            }
        } catch (RuntimeException e) {
            log.error("Tick failed: {}", e.getMessage(), e);
        } finally {
            completedTicks.incrementAndGet();
            lastTickDurationMs = Duration.between(started, clock.instant()).toMillis();
        }
    }

    private void processToken(String tokenId, List<String> positionIds) {
        double price;
        try {
            price = priceOracle.getPrice(tokenId);
        } catch (PriceUnavailableException e) {
            log.warn("Price unavailable for {}, skipping {} positions this tick: {}",
                    tokenId, positionIds.size(), e.getMessage());
            return;
        }
        if (!(price > 0) || Double.isInfinite(price)) {
            log.warn("Invalid price {} for {}, skipping {} positions this tick", price, tokenId, positionIds.size());
            return;
        }

        Instant now = clock.instant();
        for (String positionId : positionIds) {
            processPosition(positionId, price, now);
        }
    }

    private void processPosition(String positionId, double price, Instant now) {
        try {
            Optional<Position> updated = positionManager.recordPrice(positionId, price, now);
            if (updated.isEmpty()) {
                return;
            }
            Position position = updated.get();
            if (position.hasPendingAction() || position.isManualInterventionRequired()) {
                return;
            }

            Optional<ScaleInPhase> phase = scaleInPlanner.nextPhase(position, price);
            if (phase.isPresent()) {
                report(positionId, "scale-in phase " + phase.get().getPhaseNumber(),
                        positionManager.applyScaleIn(positionId, phase.get()));
                return;
            }

            ExitAction action = exitRuleEvaluator.evaluate(position, price, now);
            if (action.isFullClose()) {
                report(positionId, action.getDescription(),
                        positionManager.applyFullClose(positionId, price, action.getReason()));
            } else if (action.isPartialClose()) {
                report(positionId, action.getDescription(),
                        positionManager.applyPartialClose(positionId, action.getFraction(), action.getLevelId()));
            }
        } catch (ConcurrencyViolationException e) {
            log.warn("Dropped duplicate action for position {}: {}", positionId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing position {}: {}", positionId, e.getMessage(), e);
        }
    }

    private void report(String positionId, String what, ActionResult result) {
        switch (result.getOutcome()) {
            case APPLIED -> log.debug("Position {}: {} applied", positionId, what);
            case SKIPPED -> log.debug("Position {}: {} skipped ({})", positionId, what, result.getMessage());
            case FAILED -> log.warn("Position {}: {} failed, will retry next tick ({})",
                    positionId, what, result.getMessage());
            case ABANDONED -> log.warn("Position {}: {} abandoned, awaiting manual intervention ({})",
                    positionId, what, result.getMessage());
        }
    }

    // ==================== STATUS ====================

    public MonitoringStatusResponse getStatus() {
        List<Position> open = positionManager.getOpenPositions();
        int awaiting = 0;
        for (Position position : open) {
            if (position.isManualInterventionRequired()) {
                awaiting++;
            }
        }
        return MonitoringStatusResponse.builder()
                .running(running)
                .tickInProgress(tickInProgress.get())
                .tickIntervalMs(config.getTickIntervalMs())
                .completedTicks(completedTicks.get())
                .skippedTicks(skippedTicks.get())
                .lastTickStartedAt(lastTickStartedAt)
                .lastTickDurationMs(lastTickDurationMs)
                .openPositions(open.size())
                .positionsAwaitingIntervention(awaiting)
                .build();
    }
}
