package com.autotrader.model;

/**
 * What happened when the position manager was asked to apply an action.
 */
public enum ActionOutcome {
    /** Trade executed and state mutated */
    APPLIED,
    /** Nothing to do: already executed, position closed, or nothing left to sell */
    SKIPPED,
    /** Trade failed; state untouched and the condition will be retried next tick */
    FAILED,
    /** Trade failed and the retry budget is exhausted; operator must intervene */
    ABANDONED
}
