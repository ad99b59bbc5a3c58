package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * The single in-flight action held against a position while the trade executor call runs.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PendingAction {

    private PendingActionType type;

    /** Key identifying the triggering condition, e.g. FULL_CLOSE:STOP_LOSS or PARTIAL_CLOSE:L1 */
    private String actionKey;

    private Instant startedAt;
}
