package com.autotrader.gateway;

/**
 * Executes swaps between the quote currency and tokens.
 * <p>
 * Implementations report business failures through {@link TradeResult#failure(String)};
 * a thrown runtime exception is treated the same way by callers.
 */
public interface TradeExecutor {

    /**
     * Spend {@code amountQuote} of quote currency on {@code tokenId}.
     */
    TradeResult buy(String tokenId, double amountQuote, TradeOptions options);

    /**
     * Sell {@code amountBase} of {@code tokenId} for quote currency.
     */
    TradeResult sell(String tokenId, double amountBase, TradeOptions options);
}
