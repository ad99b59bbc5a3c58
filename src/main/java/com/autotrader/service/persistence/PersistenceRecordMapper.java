package com.autotrader.service.persistence;

import com.autotrader.entity.PositionEntity;
import com.autotrader.entity.StrategyEntity;
import com.autotrader.exception.StorageCorruptionException;
import com.autotrader.model.ExitRules;
import com.autotrader.model.NotificationSettings;
import com.autotrader.model.Position;
import com.autotrader.model.ScaleInPlan;
import com.autotrader.model.SellRecord;
import com.autotrader.model.Strategy;
import com.autotrader.model.StrategyStats;
import com.autotrader.util.TradingConstants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between domain records and JPA entities.
 * <p>
 * Nested structures are written as JSON tagged with {@link TradingConstants#SCHEMA_VERSION}.
 * Reading a record with an unknown schema version or malformed JSON raises
 * {@link StorageCorruptionException}.
 */
@Component
@RequiredArgsConstructor
public class PersistenceRecordMapper {

    private static final TypeReference<List<SellRecord>> SELL_HISTORY_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    // ==================== POSITION ====================

    public PositionEntity toEntity(Position position) {
        return PositionEntity.builder()
                .id(position.getId())
                .tokenId(position.getTokenId())
                .tokenSymbol(position.getTokenSymbol())
                .strategyId(position.getStrategyId())
                .status(position.getStatus())
                .entryPrice(position.getEntryPrice())
                .entryTimestamp(position.getEntryTimestamp())
                .averageEntryPrice(position.getAverageEntryPrice())
                .amountTotal(position.getAmountTotal())
                .amountRemaining(position.getAmountRemaining())
                .budgetQuote(position.getBudgetQuote())
                .investedQuote(position.getInvestedQuote())
                .currentPrice(position.getCurrentPrice())
                .highestPriceSeen(position.getHighestPriceSeenSinceEntry())
                .trailingStopActivated(position.isTrailingStopActivated())
                .schemaVersion(TradingConstants.SCHEMA_VERSION)
                .exitRulesJson(write(position.getExitRules(), position.getId()))
                .scaleInPlanJson(position.getScaleInPlan() != null
                        ? write(position.getScaleInPlan(), position.getId()) : null)
                .sellHistoryJson(write(position.getSellHistory(), position.getId()))
                .exitPrice(position.getExitPrice())
                .realizedProfitPercent(position.getRealizedProfitPercent())
                .closeReason(position.getCloseReason())
                .closedAt(position.getClosedAt())
                .exitTxRef(position.getExitTxRef())
                .quoteReceived(position.getQuoteReceived())
                .lastError(truncate(position.getLastError(), 1000))
                .lastActionAttemptAt(position.getLastActionAttemptAt())
                .manualInterventionRequired(position.isManualInterventionRequired())
                .lastCheckedAt(position.getLastCheckedAt())
                .build();
    }

    public Position toPosition(PositionEntity entity) {
        checkSchemaVersion(entity.getSchemaVersion(), "position", entity.getId());
        if (entity.getStatus() == null || entity.getEntryPrice() <= 0) {
            throw new StorageCorruptionException("Position " + entity.getId() + " is missing status or entry price");
        }

        ExitRules exitRules = read(entity.getExitRulesJson(), ExitRules.class, entity.getId());
        if (exitRules == null) {
            throw new StorageCorruptionException("Position " + entity.getId() + " has no exit rules");
        }
        ScaleInPlan scaleInPlan = read(entity.getScaleInPlanJson(), ScaleInPlan.class, entity.getId());
        List<SellRecord> sellHistory = readSellHistory(entity.getSellHistoryJson(), entity.getId());

        return Position.builder()
                .id(entity.getId())
                .tokenId(entity.getTokenId())
                .tokenSymbol(entity.getTokenSymbol())
                .strategyId(entity.getStrategyId())
                .status(entity.getStatus())
                .entryPrice(entity.getEntryPrice())
                .entryTimestamp(entity.getEntryTimestamp())
                .averageEntryPrice(entity.getAverageEntryPrice())
                .amountTotal(entity.getAmountTotal())
                .amountRemaining(entity.getAmountRemaining())
                .budgetQuote(entity.getBudgetQuote())
                .investedQuote(entity.getInvestedQuote())
                .currentPrice(entity.getCurrentPrice())
                .highestPriceSeenSinceEntry(entity.getHighestPriceSeen())
                .trailingStopActivated(entity.isTrailingStopActivated())
                .exitRules(exitRules.copy())
                .scaleInPlan(scaleInPlan)
                .sellHistory(sellHistory)
                .exitPrice(entity.getExitPrice())
                .realizedProfitPercent(entity.getRealizedProfitPercent())
                .closeReason(entity.getCloseReason())
                .closedAt(entity.getClosedAt())
                .exitTxRef(entity.getExitTxRef())
                .quoteReceived(entity.getQuoteReceived())
                .lastError(entity.getLastError())
                .lastActionAttemptAt(entity.getLastActionAttemptAt())
                .manualInterventionRequired(entity.isManualInterventionRequired())
                .lastCheckedAt(entity.getLastCheckedAt())
                .build();
    }

    // ==================== STRATEGY ====================

    public StrategyEntity toEntity(Strategy strategy) {
        NotificationSettings notifications = strategy.getNotifications() != null
                ? strategy.getNotifications() : new NotificationSettings();
        StrategyStats stats = strategy.getStats() != null ? strategy.getStats() : new StrategyStats();
        return StrategyEntity.builder()
                .id(strategy.getId())
                .name(strategy.getName())
                .enabled(strategy.isEnabled())
                .createdAt(strategy.getCreatedAt())
                .lastRunAt(strategy.getLastRunAt())
                .maxConcurrentPositions(strategy.getMaxConcurrentPositions())
                .maxPositionSize(strategy.getMaxPositionSize())
                .totalBudget(strategy.getTotalBudget())
                .schemaVersion(TradingConstants.SCHEMA_VERSION)
                .defaultExitRulesJson(strategy.getDefaultExitRules() != null
                        ? write(strategy.getDefaultExitRules(), strategy.getId()) : null)
                .defaultScaleInPlanJson(strategy.getDefaultScaleInPlan() != null
                        ? write(strategy.getDefaultScaleInPlan(), strategy.getId()) : null)
                .notifyOnEntry(notifications.isOnEntry())
                .notifyOnExit(notifications.isOnExit())
                .notifyOnError(notifications.isOnError())
                .totalTrades(stats.getTotalTrades())
                .successfulTrades(stats.getSuccessfulTrades())
                .failedTrades(stats.getFailedTrades())
                .realizedProfit(stats.getRealizedProfit())
                .build();
    }

    public Strategy toStrategy(StrategyEntity entity) {
        checkSchemaVersion(entity.getSchemaVersion(), "strategy", entity.getId());
        return Strategy.builder()
                .id(entity.getId())
                .name(entity.getName())
                .enabled(entity.isEnabled())
                .createdAt(entity.getCreatedAt())
                .lastRunAt(entity.getLastRunAt())
                .maxConcurrentPositions(entity.getMaxConcurrentPositions())
                .maxPositionSize(entity.getMaxPositionSize())
                .totalBudget(entity.getTotalBudget())
                .defaultExitRules(read(entity.getDefaultExitRulesJson(), ExitRules.class, entity.getId()))
                .defaultScaleInPlan(read(entity.getDefaultScaleInPlanJson(), ScaleInPlan.class, entity.getId()))
                .notifications(new NotificationSettings(entity.isNotifyOnEntry(),
                        entity.isNotifyOnExit(), entity.isNotifyOnError()))
                .stats(new StrategyStats(entity.getTotalTrades(), entity.getSuccessfulTrades(),
                        entity.getFailedTrades(), entity.getRealizedProfit()))
                .build();
    }

    // ==================== JSON HELPERS ====================

    private void checkSchemaVersion(int version, String kind, String id) {
        if (version != TradingConstants.SCHEMA_VERSION) {
            throw new StorageCorruptionException("Unsupported schema version " + version
                    + " for " + kind + " " + id);
        }
    }

    private String write(Object value, String id) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize record " + id, e);
        }
    }

    private <T> T read(String json, Class<T> type, String id) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new StorageCorruptionException("Malformed " + type.getSimpleName() + " JSON for record " + id, e);
        }
    }

    private List<SellRecord> readSellHistory(String json, String id) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, SELL_HISTORY_TYPE));
        } catch (JsonProcessingException e) {
            throw new StorageCorruptionException("Malformed sell history JSON for record " + id, e);
        }
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
