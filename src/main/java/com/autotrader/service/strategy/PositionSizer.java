package com.autotrader.service.strategy;

import com.autotrader.model.Position;
import com.autotrader.model.ScaleInPlan;
import com.autotrader.model.Strategy;
import com.autotrader.util.TradingConstants;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Budget checks and deterministic sizing for strategy entries.
 *
 * <ul>
 *   <li>Refuse when the strategy already holds maxConcurrentPositions open positions</li>
 *   <li>Remaining budget = totalBudget - sum of open position budgets; refuse when it is
 *       below half of maxPositionSize</li>
 *   <li>Position budget = min(maxPositionSize, remaining)</li>
 *   <li>Initial buy = budget * (1 - sum of scale-in phase fractions)</li>
 * </ul>
 */
@Component
public class PositionSizer {

    public PositionSizingDecision size(Strategy strategy, List<Position> openStrategyPositions) {
        if (openStrategyPositions.size() >= strategy.getMaxConcurrentPositions()) {
            return PositionSizingDecision.refuse("Strategy " + strategy.getName() + " already has "
                    + openStrategyPositions.size() + " open positions (max " + strategy.getMaxConcurrentPositions() + ")");
        }

        double used = 0.0;
        for (Position position : openStrategyPositions) {
            used += position.getBudgetQuote();
        }
        double remaining = strategy.getTotalBudget() - used;
        if (remaining < strategy.getMaxPositionSize() * TradingConstants.MIN_REMAINING_BUDGET_RATIO) {
            return PositionSizingDecision.refuse("Insufficient budget for strategy " + strategy.getName()
                    + ": remaining " + remaining + " of " + strategy.getTotalBudget());
        }

        double budget = Math.min(strategy.getMaxPositionSize(), remaining);
        ScaleInPlan plan = strategy.getDefaultScaleInPlan();
        double initialFraction = plan != null && plan.isEnabled() ? 1.0 - plan.totalSizeFraction() : 1.0;
        if (initialFraction <= 0) {
            return PositionSizingDecision.refuse("Scale-in plan of strategy " + strategy.getName()
                    + " leaves nothing for the initial buy");
        }
        return PositionSizingDecision.allow(budget, budget * initialFraction);
    }
}
