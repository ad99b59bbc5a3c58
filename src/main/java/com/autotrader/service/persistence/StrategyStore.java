package com.autotrader.service.persistence;

import com.autotrader.model.Strategy;

public interface StrategyStore extends PersistenceStore<Strategy> {

    void delete(String id);
}
