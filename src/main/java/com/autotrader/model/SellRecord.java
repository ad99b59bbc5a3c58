package com.autotrader.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * History entry for every sell executed against a position.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SellRecord {

    private Instant timestamp;

    private double amount;

    private double price;

    private ExitReason reason;

    /** Partial level id, null for full closes */
    private String levelId;

    private double quoteReceived;

    private String txRef;
}
