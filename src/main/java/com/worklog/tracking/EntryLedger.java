package com.worklog.tracking;

import com.worklog.model.TimeEntry;
import com.worklog.model.WorkDay;
import com.worklog.storage.SessionStore;
import com.worklog.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public class EntryLedger {

    private static final Logger log = LoggerFactory.getLogger(EntryLedger.class);

    private final SessionStore store;
    private final Clock clock;
    private final OwnerLocks locks;
    private final RequestValidator validator;

    public EntryLedger(SessionStore store, Clock clock, OwnerLocks locks, RequestValidator validator) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public TimeEntry addEntry(String ownerId, EntryRequest request) throws TrackingException, StorageException {
        Objects.requireNonNull(request, "request");
        String owner = validator.owner(ownerId);
        int minutes = validator.durationMinutes(request.durationMinutes());
        String description = validator.description(request.description());
        Optional<String> commitHash = validator.commitHash(request.commitHash());
        Optional<String> jiraTicket = validator.jiraTicket(request.jiraTicket());
        Optional<String> project = validator.project(request.project());

        return locks.withLock(owner, () -> {
            WorkDay day = resolveWorkDay(owner, request.workDayId());
            TimeEntry entry = new TimeEntry(
                    UUID.randomUUID(),
                    day.id(),
                    description,
                    minutes,
                    clock.instant(),
                    commitHash,
                    jiraTicket,
                    project,
                    TimeEntry.normalizeTags(request.tags()));
            store.save(day.withEntry(entry));
            log.info("Logged {} minute(s) on work day {} ({})", minutes, day.id(), day.status());
            return entry;
        });
    }

    private WorkDay resolveWorkDay(String owner, Optional<UUID> workDayId) throws TrackingException, StorageException {
        if (workDayId.isPresent()) {
            return store.loadById(owner, workDayId.get())
                    .orElseThrow(() -> TrackingException.notFound("Work day " + workDayId.get() + " not found"));
        }
        return TimerStateMachine.activeWorkDay(store, owner);
    }
}
