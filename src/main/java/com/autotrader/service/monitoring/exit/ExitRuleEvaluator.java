package com.autotrader.service.monitoring.exit;

import com.autotrader.exception.InvalidInputException;
import com.autotrader.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Decides what, if anything, to do with a position at a given price.
 * <p>
 * Rules are evaluated in ascending priority and the first one that produces an action wins,
 * so stop loss always dominates take profit when both thresholds are crossed. The evaluator
 * is a pure function of its inputs: it never mutates the position.
 */
@Slf4j
@Component
public class ExitRuleEvaluator {

    private final List<ExitRule> rules;

    public ExitRuleEvaluator() {
        this(List.of(
                new StopLossExitRule(),
                new MaxHoldTimeExitRule(),
                new TakeProfitExitRule(),
                new TrailingStopExitRule(),
                new PartialProfitExitRule()));
    }

    public ExitRuleEvaluator(List<ExitRule> rules) {
        List<ExitRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(ExitRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * @param position     position to evaluate, must be OPEN or PARTIALLY_CLOSED
     * @param currentPrice strictly positive price
     * @param now          evaluation time used for max hold checks
     * @return the action of the highest priority matching rule, or {@link ExitAction#none()}
     * @throws InvalidInputException on a non-positive price or an inactive position
     */
    public ExitAction evaluate(Position position, double currentPrice, Instant now) {
        if (!(currentPrice > 0)) {
            throw new InvalidInputException("Price must be positive, got " + currentPrice);
        }
        if (position == null || !position.isActive()) {
            throw new InvalidInputException("Position is not open: "
                    + (position != null ? position.getId() : "null"));
        }
        if (position.getExitRules() == null) {
            return ExitAction.none();
        }

        ExitContext ctx = ExitContext.of(position, currentPrice, now);
        for (ExitRule rule : rules) {
            if (!rule.isEnabled(ctx)) {
                continue;
            }
            ExitAction action = rule.evaluate(ctx);
            if (action.requiresAction()) {
                log.debug("Rule {} matched for position {}: {}", rule.getName(), position.getId(), action);
                return action;
            }
        }
        return ExitAction.none();
    }

    public List<ExitRule> getRules() {
        return rules;
    }
}
