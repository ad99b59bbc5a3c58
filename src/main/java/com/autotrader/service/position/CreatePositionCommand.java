package com.autotrader.service.position;

import com.autotrader.model.ExitRules;
import com.autotrader.model.ScaleInPlan;
import lombok.Builder;
import lombok.Value;

/**
 * Everything needed to register a position for a buy that has already completed.
 * Optional fields are null when absent.
 */
@Value
@Builder
public class CreatePositionCommand {

    String tokenId;
    String tokenSymbol;
    String strategyId;
    double entryPrice;
    double amount;

    /** Quote budget reserved for the position, defaults to entryPrice * amount */
    Double budgetQuote;

    /** Quote spent on the initial buy, defaults to entryPrice * amount */
    Double investedQuote;

    ExitRules exitRules;
    ScaleInPlan scaleInPlan;
}
