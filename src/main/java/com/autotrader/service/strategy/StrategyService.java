package com.autotrader.service.strategy;

import com.autotrader.config.TradingConfig;
import com.autotrader.dto.PerformanceStatsResponse;
import com.autotrader.dto.StrategyRequest;
import com.autotrader.exception.InvalidInputException;
import com.autotrader.exception.ResourceNotFoundException;
import com.autotrader.model.NotificationSettings;
import com.autotrader.model.ScaleInPlan;
import com.autotrader.model.Strategy;
import com.autotrader.model.StrategyStats;
import com.autotrader.notification.NotificationEventType;
import com.autotrader.notification.PositionEvent;
import com.autotrader.service.persistence.StrategyStore;
import com.autotrader.service.position.PositionValidator;
import com.autotrader.util.TradingConstants;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Strategy management: CRUD, enable/disable and running trade statistics.
 * <p>
 * Strategies are kept in memory and written through to the strategy store on every change.
 * Realised profit is accumulated from position sell events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyService {

    private final StrategyStore strategyStore;
    private final TradingConfig tradingConfig;
    private final Clock clock;

    private final Map<String, Strategy> strategies = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadStrategies() {
        List<Strategy> loaded = strategyStore.loadAll();
        for (Strategy strategy : loaded) {
            strategies.put(strategy.getId(), strategy);
        }
        log.info("Loaded {} strategies from storage", loaded.size());
    }

    // ==================== CRUD ====================

    public Strategy createStrategy(StrategyRequest request) {
        validateName(request);
        Strategy strategy = Strategy.builder()
                .id(TradingConstants.STRATEGY_ID_PREFIX + UUID.randomUUID())
                .name(request.getName().trim())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .createdAt(clock.instant())
                .maxConcurrentPositions(request.getMaxConcurrentPositions() != null
                        ? request.getMaxConcurrentPositions() : TradingConstants.DEFAULT_MAX_CONCURRENT_POSITIONS)
                .maxPositionSize(request.getMaxPositionSize() != null
                        ? request.getMaxPositionSize() : TradingConstants.DEFAULT_MAX_POSITION_SIZE)
                .totalBudget(request.getTotalBudget() != null
                        ? request.getTotalBudget() : TradingConstants.DEFAULT_TOTAL_BUDGET)
                .defaultExitRules(PositionValidator.normalizeExitRules(request.getExitRules() != null
                        ? request.getExitRules() : tradingConfig.defaultExitRules()))
                .defaultScaleInPlan(normalizeStrategyPlan(request.getScaleInPlan()))
                .notifications(request.getNotifications() != null
                        ? request.getNotifications().copy() : new NotificationSettings())
                .stats(new StrategyStats())
                .build();
        validateLimits(strategy);

        strategyStore.save(strategy);
        strategies.put(strategy.getId(), strategy);
        log.info("Strategy created: id={}, name={}, maxPositions={}, maxSize={}, budget={}",
                strategy.getId(), strategy.getName(), strategy.getMaxConcurrentPositions(),
                strategy.getMaxPositionSize(), strategy.getTotalBudget());
        return strategy.snapshot();
    }

    /**
     * Replaces limits, templates and flags. Fields missing from the request keep their value;
     * stats and creation time are never touched.
     */
    public Strategy updateStrategy(String strategyId, StrategyRequest request) {
        Strategy strategy = requireStrategy(strategyId);
        validateName(request);
        Strategy updated;
        synchronized (strategy) {
            Strategy candidate = strategy.snapshot();
            candidate.setName(request.getName().trim());
            if (request.getEnabled() != null) {
                candidate.setEnabled(request.getEnabled());
            }
            if (request.getMaxConcurrentPositions() != null) {
                candidate.setMaxConcurrentPositions(request.getMaxConcurrentPositions());
            }
            if (request.getMaxPositionSize() != null) {
                candidate.setMaxPositionSize(request.getMaxPositionSize());
            }
            if (request.getTotalBudget() != null) {
                candidate.setTotalBudget(request.getTotalBudget());
            }
            if (request.getExitRules() != null) {
                candidate.setDefaultExitRules(PositionValidator.normalizeExitRules(request.getExitRules()));
            }
            if (request.getScaleInPlan() != null) {
                candidate.setDefaultScaleInPlan(normalizeStrategyPlan(request.getScaleInPlan()));
            }
            if (request.getNotifications() != null) {
                candidate.setNotifications(request.getNotifications().copy());
            }
            validateLimits(candidate);

            strategy.setName(candidate.getName());
            strategy.setEnabled(candidate.isEnabled());
            strategy.setMaxConcurrentPositions(candidate.getMaxConcurrentPositions());
            strategy.setMaxPositionSize(candidate.getMaxPositionSize());
            strategy.setTotalBudget(candidate.getTotalBudget());
            strategy.setDefaultExitRules(candidate.getDefaultExitRules());
            strategy.setDefaultScaleInPlan(candidate.getDefaultScaleInPlan());
            strategy.setNotifications(candidate.getNotifications());
            updated = strategy.snapshot();
        }
        strategyStore.save(updated);
        log.info("Strategy updated: id={}, name={}", strategyId, updated.getName());
        return updated;
    }

    public Strategy getStrategy(String strategyId) {
        return requireStrategy(strategyId).snapshot();
    }

    public Optional<Strategy> findStrategy(String strategyId) {
        if (strategyId == null) {
            return Optional.empty();
        }
        Strategy strategy = strategies.get(strategyId);
        return strategy != null ? Optional.of(strategy.snapshot()) : Optional.empty();
    }

    public List<Strategy> listStrategies() {
        List<Strategy> result = new ArrayList<>();
        for (Strategy strategy : strategies.values()) {
            result.add(strategy.snapshot());
        }
        result.sort(Comparator.comparing(Strategy::getCreatedAt));
        return result;
    }

    public void deleteStrategy(String strategyId) {
        requireStrategy(strategyId);
        strategyStore.delete(strategyId);
        strategies.remove(strategyId);
        log.info("Strategy deleted: id={}", strategyId);
    }

    public Strategy setEnabled(String strategyId, boolean enabled) {
        Strategy strategy = requireStrategy(strategyId);
        Strategy updated;
        synchronized (strategy) {
            strategy.setEnabled(enabled);
            updated = strategy.snapshot();
        }
        strategyStore.save(updated);
        log.info("Strategy {} {}", strategyId, enabled ? "enabled" : "disabled");
        return updated;
    }

    // ==================== STATS ====================

    /**
     * Counts an entry attempt made on behalf of the strategy.
     */
    public void recordTradeOutcome(String strategyId, boolean success) {
        Strategy strategy = strategies.get(strategyId);
        if (strategy == null) {
            log.warn("Trade outcome for unknown strategy {}", strategyId);
            return;
        }
        Strategy updated;
        synchronized (strategy) {
            StrategyStats stats = strategy.getStats();
            stats.setTotalTrades(stats.getTotalTrades() + 1);
            if (success) {
                stats.setSuccessfulTrades(stats.getSuccessfulTrades() + 1);
            } else {
                stats.setFailedTrades(stats.getFailedTrades() + 1);
            }
            strategy.setLastRunAt(clock.instant());
            updated = strategy.snapshot();
        }
        strategyStore.save(updated);
    }

    /**
     * Accumulates realised profit from sells of strategy-owned positions.
     */
    @EventListener
    public void onPositionEvent(PositionEvent event) {
        if (event.type() != NotificationEventType.PARTIAL_SELL_EXECUTED
                && event.type() != NotificationEventType.POSITION_CLOSED) {
            return;
        }
        String strategyId = event.strategyId();
        if (strategyId == null) {
            return;
        }
        double profit = event.doubleValue(TradingConstants.KEY_REALIZED_PROFIT);
        if (profit == 0.0) {
            return;
        }
        Strategy strategy = strategies.get(strategyId);
        if (strategy == null) {
            log.debug("Ignoring {} event for deleted strategy {}", event.type(), strategyId);
            return;
        }
        Strategy updated;
        synchronized (strategy) {
            StrategyStats stats = strategy.getStats();
            stats.setRealizedProfit(stats.getRealizedProfit() + profit);
            updated = strategy.snapshot();
        }
        strategyStore.save(updated);
        log.debug("Strategy {} realised profit += {} (position {})", strategyId, profit, event.positionId());
    }

    public PerformanceStatsResponse getPerformanceStats() {
        List<Strategy> all = listStrategies();
        int totalTrades = 0;
        int successfulTrades = 0;
        int failedTrades = 0;
        double totalProfit = 0.0;
        int active = 0;
        for (Strategy strategy : all) {
            StrategyStats stats = strategy.getStats();
            totalTrades += stats.getTotalTrades();
            successfulTrades += stats.getSuccessfulTrades();
            failedTrades += stats.getFailedTrades();
            totalProfit += stats.getRealizedProfit();
            if (strategy.isEnabled()) {
                active++;
            }
        }
        return PerformanceStatsResponse.builder()
                .strategyCount(all.size())
                .activeStrategies(active)
                .totalTrades(totalTrades)
                .successfulTrades(successfulTrades)
                .failedTrades(failedTrades)
                .winRate(totalTrades > 0 ? (double) successfulTrades / totalTrades * 100.0 : 0.0)
                .totalProfit(totalProfit)
                .build();
    }

    // ==================== VALIDATION ====================

    private Strategy requireStrategy(String strategyId) {
        Strategy strategy = strategyId != null ? strategies.get(strategyId) : null;
        if (strategy == null) {
            throw new ResourceNotFoundException("Strategy not found: " + strategyId);
        }
        return strategy;
    }

    private static void validateName(StrategyRequest request) {
        if (request == null || request.getName() == null || request.getName().isBlank()) {
            throw new InvalidInputException("Strategy name is required");
        }
    }

    private static void validateLimits(Strategy strategy) {
        if (strategy.getMaxConcurrentPositions() <= 0) {
            throw new InvalidInputException("maxConcurrentPositions must be positive");
        }
        PositionValidator.requirePositive(strategy.getMaxPositionSize(), "maxPositionSize");
        PositionValidator.requirePositive(strategy.getTotalBudget(), "totalBudget");
        if (strategy.getMaxPositionSize() > strategy.getTotalBudget()) {
            throw new InvalidInputException("maxPositionSize must not exceed totalBudget");
        }
    }

    /**
     * Strategy plans must leave part of the budget for the initial buy.
     */
    private static ScaleInPlan normalizeStrategyPlan(ScaleInPlan plan) {
        ScaleInPlan normalized = PositionValidator.normalizeScaleInPlan(plan);
        if (normalized != null && normalized.isEnabled() && normalized.totalSizeFraction() >= 1.0) {
            throw new InvalidInputException("Scale-in size fractions must sum to less than 1.0 to leave room for the initial buy");
        }
        if (normalized != null && normalized.getCurrentPhase() != 0) {
            throw new InvalidInputException("Strategy scale-in template must start at phase 0");
        }
        return normalized;
    }
}
