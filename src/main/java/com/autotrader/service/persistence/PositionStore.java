package com.autotrader.service.persistence;

import com.autotrader.model.Position;

import java.util.List;

public interface PositionStore extends PersistenceStore<Position> {

    /**
     * Positions that are OPEN or PARTIALLY_CLOSED, oldest first.
     */
    List<Position> loadActive();

    /**
     * All positions of a strategy including closed ones, newest first.
     */
    List<Position> loadByStrategy(String strategyId);
}
