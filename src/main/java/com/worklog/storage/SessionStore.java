package com.worklog.storage;

import com.worklog.model.WorkDay;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for work day aggregates, keyed by owner. Callers hold the owner's lock around every
 * call; implementations only need to make a single {@link #save} all-or-nothing.
 */
public interface SessionStore extends AutoCloseable {

    /**
     * The owner's current work day: the most recently created one, whatever its status.
     */
    Optional<WorkDay> load(String ownerId) throws StorageException;

    Optional<WorkDay> loadById(String ownerId, UUID workDayId) throws StorageException;

    List<WorkDay> history(String ownerId) throws StorageException;

    void save(WorkDay workDay) throws StorageException;

    @Override
    default void close() throws StorageException {
        // nothing to release
    }
}
