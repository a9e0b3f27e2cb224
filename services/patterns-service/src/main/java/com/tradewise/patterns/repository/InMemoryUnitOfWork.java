package com.tradewise.patterns.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Unit of work over in-memory repositories. Performs no I/O; one instance per unit.
 */
@Slf4j
@Component
@Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
public class InMemoryUnitOfWork implements UnitOfWork {

    private final List<Runnable> pendingChanges = new ArrayList<>();
    private boolean inTransaction;

    @Override
    public synchronized void begin() {
        inTransaction = true;
        pendingChanges.clear();
        log.debug("Unit of work begun");
    }

    @Override
    public synchronized void registerChange(Runnable change) {
        if (inTransaction) {
            pendingChanges.add(change);
        } else {
            change.run();
        }
    }

    @Override
    public synchronized int saveChanges() {
        int applied = pendingChanges.size();
        pendingChanges.forEach(Runnable::run);
        pendingChanges.clear();
        inTransaction = false;
        log.debug("Unit of work saved {} changes", applied);
        return applied;
    }

    @Override
    public synchronized void commit() {
        inTransaction = false;
        pendingChanges.clear();
        log.debug("Unit of work committed");
    }

    @Override
    public synchronized void rollback() {
        int discarded = pendingChanges.size();
        pendingChanges.clear();
        inTransaction = false;
        log.debug("Unit of work rolled back, {} changes discarded", discarded);
    }

    @Override
    public synchronized int pendingChangeCount() {
        return pendingChanges.size();
    }
}
