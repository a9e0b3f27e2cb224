package com.tradewise.patterns.repository;

import java.util.List;
import java.util.Optional;

/**
 * Generic keyed store abstracting data access from business logic.
 *
 * @param <T> entity type
 * @param <K> key type
 */
public interface Repository<T, K> {

    Optional<T> findById(K id);

    List<T> findAll();

    /**
     * Stores the entity, replacing any entity with the same key.
     */
    void add(T entity);

    /**
     * @throws com.tradewise.common.error.ResourceNotFoundException if no entity has the entity's key
     */
    void update(T entity);

    void delete(K id);

    boolean exists(K id);
}
