/**
 * Exit rules for position monitoring.
 *
 * <h2>Architecture</h2>
 * <ul>
 *   <li>{@link com.autotrader.service.monitoring.exit.ExitRule} - Base interface for all rules</li>
 *   <li>{@link com.autotrader.service.monitoring.exit.ExitContext} - One position at one price</li>
 *   <li>{@link com.autotrader.service.monitoring.exit.ExitAction} - Result of an evaluation</li>
 *   <li>{@link com.autotrader.service.monitoring.exit.ExitRuleEvaluator} - First match wins</li>
 * </ul>
 *
 * <h2>Evaluation Order</h2>
 * Rules are evaluated in priority order (lower = first):
 * <ol>
 *   <li>Stop Loss (0)</li>
 *   <li>Max Hold Time (100) - forced liquidation, ignores P&L</li>
 *   <li>Take Profit (200)</li>
 *   <li>Trailing Stop (300) - only after the trigger has been crossed</li>
 *   <li>Partial Profit (400) - one level per evaluation</li>
 * </ol>
 *
 * @see com.autotrader.service.monitoring.PositionMonitoringService
 */
package com.autotrader.service.monitoring.exit;
