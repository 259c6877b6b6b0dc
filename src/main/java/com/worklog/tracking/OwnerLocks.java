package com.worklog.tracking;

import com.worklog.storage.StorageException;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per owner. Operations on different owners never wait on each other. A lock is dropped
 * once no thread holds or waits for it, so the map only holds owners that are in use.
 */
public final class OwnerLocks {

    @FunctionalInterface
    public interface LockedAction<T> {
        T run() throws TrackingException, StorageException;
    }

    private static final class Slot {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }

    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final long timeoutMillis;

    public OwnerLocks(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
        this.timeoutMillis = timeout.toMillis();
    }

    public <T> T withLock(String ownerId, LockedAction<T> action) throws TrackingException, StorageException {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(action, "action");
        Slot slot = slots.compute(ownerId, (id, existing) -> {
            Slot current = existing == null ? new Slot() : existing;
            current.users++;
            return current;
        });
        try {
            boolean acquired;
            try {
                acquired = slot.lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw TrackingException.conflict("Interrupted while waiting for work day of " + ownerId);
            }
            if (!acquired) {
                throw TrackingException.conflict("Work day of " + ownerId + " is busy; gave up after "
                        + timeoutMillis + " ms");
            }
            try {
                return action.run();
            } finally {
                slot.lock.unlock();
            }
        } finally {
            release(ownerId);
        }
    }

    int trackedOwners() {
        return slots.size();
    }

    private void release(String ownerId) {
        slots.computeIfPresent(ownerId, (id, slot) -> --slot.users == 0 ? null : slot);
    }
}
