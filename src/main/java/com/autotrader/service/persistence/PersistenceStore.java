package com.autotrader.service.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Durable store for one kind of record.
 *
 * @param <T> record type
 */
public interface PersistenceStore<T> {

    void save(T record);

    /**
     * @throws com.autotrader.exception.StorageCorruptionException if the stored record cannot be read
     */
    Optional<T> load(String id);

    /**
     * @throws com.autotrader.exception.StorageCorruptionException if any stored record cannot be read
     */
    List<T> loadAll();
}
