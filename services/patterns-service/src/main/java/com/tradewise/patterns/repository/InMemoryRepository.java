package com.tradewise.patterns.repository;

import com.tradewise.common.error.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Thread-safe map-backed repository. Keys are derived from entities by the supplied selector.
 */
@Slf4j
public class InMemoryRepository<T, K> implements Repository<T, K> {

    private final Map<K, T> store = new ConcurrentHashMap<>();
    private final Function<T, K> keySelector;

    public InMemoryRepository(Function<T, K> keySelector) {
        this.keySelector = keySelector;
    }

    @Override
    public Optional<T> findById(K id) {
        return Optional.ofNullable(store.get(id));
    }

    @Override
    public List<T> findAll() {
        return List.copyOf(store.values());
    }

    @Override
    public void add(T entity) {
        K key = keySelector.apply(entity);
        store.put(key, entity);
        log.debug("Added entity {} to repository", key);
    }

    @Override
    public void update(T entity) {
        K key = keySelector.apply(entity);
        if (store.replace(key, entity) == null) {
            throw ResourceNotFoundException.entityNotFound(key);
        }
        log.debug("Updated entity {} in repository", key);
    }

    @Override
    public void delete(K id) {
        store.remove(id);
        log.debug("Deleted entity {} from repository", id);
    }

    @Override
    public boolean exists(K id) {
        return store.containsKey(id);
    }
}
