package com.worklog.tracking;

import com.worklog.aggregation.Report;
import com.worklog.aggregation.ReportAggregator;
import com.worklog.config.TrackingConfig;
import com.worklog.model.Meeting;
import com.worklog.model.MeetingType;
import com.worklog.model.TimeEntry;
import com.worklog.model.WorkDay;
import com.worklog.storage.SessionStore;
import com.worklog.storage.StorageException;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public class WorklogEngine {

    private final SessionStore store;
    private final OwnerLocks locks;
    private final RequestValidator validator;
    private final TimerStateMachine timers;
    private final EntryLedger ledger;
    private final ReportAggregator aggregator;
    private final ZoneId zone;

    public WorklogEngine(SessionStore store, Clock clock, TrackingConfig config) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(clock, "clock");
        TrackingConfig resolved = Objects.requireNonNull(config, "config").withDefaults();
        this.store = store;
        this.locks = new OwnerLocks(Duration.ofMillis(resolved.lockTimeoutMillis()));
        this.validator = new RequestValidator(resolved);
        this.timers = new TimerStateMachine(store, clock, locks, validator);
        this.ledger = new EntryLedger(store, clock, locks, validator);
        this.aggregator = new ReportAggregator();
        this.zone = resolved.zoneId();
    }

    public WorkDay startWorkDay(String owner, String initialActivity) throws TrackingException, StorageException {
        return timers.startWorkDay(owner, initialActivity);
    }

    public WorkDay stopWorkDay(String owner) throws TrackingException, StorageException {
        return timers.stopWorkDay(owner);
    }

    public WorkDay updateActivity(String owner, String activity) throws TrackingException, StorageException {
        return timers.updateActivity(owner, activity);
    }

    public Meeting startMeeting(String owner, String title, MeetingType type, int attendeeCount)
            throws TrackingException, StorageException {
        return timers.startMeeting(owner, title, type, attendeeCount);
    }

    public Meeting startMeeting(String owner, String title, String type, int attendeeCount)
            throws TrackingException, StorageException {
        return timers.startMeeting(owner, title, type, attendeeCount);
    }

    public Meeting stopMeeting(String owner, UUID meetingId) throws TrackingException, StorageException {
        return timers.stopMeeting(owner, meetingId);
    }

    public TrackingStatus status(String owner) throws TrackingException, StorageException {
        return timers.status(owner);
    }

    public TimeEntry addEntry(String owner, EntryRequest request) throws TrackingException, StorageException {
        return ledger.addEntry(owner, request);
    }

    public Report report(String ownerId) throws TrackingException, StorageException {
        String owner = validator.owner(ownerId);
        WorkDay day = locks.withLock(owner, () -> store.load(owner)
                .orElseThrow(() -> TrackingException.notFound("No work day found for " + owner)));
        return aggregator.buildReport(day);
    }

    /**
     * Report over every work day that started between {@code from} and {@code to} inclusive, by
     * local date in the configured zone. Days that never started are skipped.
     */
    public Report report(String ownerId, LocalDate from, LocalDate to) throws TrackingException, StorageException {
        String owner = validator.owner(ownerId);
        if (from == null || to == null) {
            throw TrackingException.validation("from and to dates are required");
        }
        if (to.isBefore(from)) {
            throw TrackingException.validation("to (" + to + ") is before from (" + from + ")");
        }
        List<WorkDay> history = locks.withLock(owner, () -> store.history(owner));
        List<WorkDay> selected = history.stream()
                .filter(day -> day.startedAt()
                        .map(started -> started.atZone(zone).toLocalDate())
                        .filter(date -> !date.isBefore(from) && !date.isAfter(to))
                        .isPresent())
                .toList();
        return aggregator.buildReport(selected);
    }

    public Report buildReport(WorkDay workDay) {
        return aggregator.buildReport(workDay);
    }
}
