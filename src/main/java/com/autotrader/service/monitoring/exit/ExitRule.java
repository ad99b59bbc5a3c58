package com.autotrader.service.monitoring.exit;

/**
 * Strategy interface for a single exit condition.
 * <p>
 * Implementations encapsulate one exit mechanism (stop loss, max hold time, take profit,
 * trailing stop, partial profit) and are evaluated in priority order by
 * {@link ExitRuleEvaluator}. The first rule that returns an action wins.
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li>Stateless evaluation - all state passed via {@link ExitContext}</li>
 *   <li>Return the shared {@link ExitAction#none()} when the condition is not met</li>
 *   <li>Single responsibility - each rule handles one exit mechanism</li>
 *   <li>Priority-based ordering - lower priority number = evaluated first</li>
 * </ul>
 *
 * @see ExitContext
 * @see ExitAction
 */
public interface ExitRule {

    /**
     * Rule priority for evaluation order. Lower values are evaluated first.
     * <p>
     * Loss protection must dominate opportunistic profit taking:
     * <ul>
     *   <li>0: stop loss</li>
     *   <li>100: max hold time</li>
     *   <li>200: take profit</li>
     *   <li>300: trailing stop</li>
     *   <li>400: partial profit levels</li>
     * </ul>
     *
     * @return priority value (lower = higher priority)
     */
    int getPriority();

    /**
     * Evaluates the exit condition for the current price.
     *
     * @param ctx evaluation context for one position at one price
     * @return exit action ({@link ExitAction#none()} for no action)
     */
    ExitAction evaluate(ExitContext ctx);

    /**
     * Human-readable name for logging and debugging.
     */
    String getName();

    /**
     * Check if this rule applies to the position at all (e.g. configured and enabled).
     *
     * @param ctx evaluation context
     * @return true if the rule should be evaluated
     */
    default boolean isEnabled(ExitContext ctx) {
        return true;
    }
}
