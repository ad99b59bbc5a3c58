package com.autotrader.util;

/**
 * Constants for position management.
 * Centralizes payload keys, id prefixes and log prefixes used across the application.
 */
public final class TradingConstants {

    // ==================== Id Prefixes ====================
    public static final String POSITION_ID_PREFIX = "pos_";
    public static final String STRATEGY_ID_PREFIX = "strat_";
    public static final String SIMULATED_TX_PREFIX = "sim_tx_";

    // ==================== Notification Payload Keys ====================
    public static final String KEY_POSITION_ID = "positionId";
    public static final String KEY_TOKEN_ID = "tokenId";
    public static final String KEY_TOKEN_SYMBOL = "tokenSymbol";
    public static final String KEY_STRATEGY_ID = "strategyId";
    public static final String KEY_REASON = "reason";
    public static final String KEY_ACTION = "action";
    public static final String KEY_AMOUNT = "amount";
    public static final String KEY_PRICE = "price";
    public static final String KEY_QUOTE = "quote";
    public static final String KEY_PROFIT_PERCENT = "profitPercent";
    public static final String KEY_REALIZED_PROFIT = "realizedProfit";
    public static final String KEY_LEVEL_ID = "levelId";
    public static final String KEY_PHASE_NUMBER = "phaseNumber";
    public static final String KEY_TX_REF = "txRef";
    public static final String KEY_ERROR = "error";
    public static final String KEY_ATTEMPTS = "attempts";

    // ==================== Persistence ====================
    /**
     * Version of the JSON layout of exit rules, scale-in plans and sell history
     */
    public static final int SCHEMA_VERSION = 1;

    // ==================== Log Prefixes ====================
    public static final String LOG_PREFIX_SIMULATION = "[SIMULATION]";

    // ==================== Strategy Defaults ====================
    public static final int DEFAULT_MAX_CONCURRENT_POSITIONS = 3;
    public static final double DEFAULT_MAX_POSITION_SIZE = 0.1;
    public static final double DEFAULT_TOTAL_BUDGET = 1.0;

    /**
     * An entry is refused when the remaining budget is below this share of maxPositionSize
     */
    public static final double MIN_REMAINING_BUDGET_RATIO = 0.5;

    private TradingConstants() {
        // Utility class - prevent instantiation
    }
}
