package com.tradewise.patterns.repository;

/**
 * Groups repository changes so they are applied together or not at all.
 */
public interface UnitOfWork {

    void begin();

    /**
     * Defers the change while a unit is open; applies it immediately otherwise.
     */
    void registerChange(Runnable change);

    /**
     * Applies every deferred change in registration order and closes the unit.
     *
     * @return the number of changes applied
     */
    int saveChanges();

    void commit();

    void rollback();

    int pendingChangeCount();
}
