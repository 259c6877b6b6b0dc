package com.worklog.tracking;

import com.worklog.model.Durations;
import com.worklog.model.Meeting;
import com.worklog.model.MeetingType;
import com.worklog.model.WorkDay;
import com.worklog.storage.SessionStore;
import com.worklog.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Work day and meeting lifecycles.
 *
 * <pre>
 * WorkDay: NOT_STARTED --start--&gt; ACTIVE --stop--&gt; ENDED
 * Meeting: (none) --start--&gt; RUNNING --stop--&gt; STOPPED
 * </pre>
 *
 * Every operation runs under the owner's lock as load, compute a new aggregate, save. Nothing is
 * saved when a check fails, so a rejected call never changes stored state. Stopping a work day
 * stops its running meeting in the same save, at the same instant.
 */
public class TimerStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TimerStateMachine.class);

    private final SessionStore store;
    private final Clock clock;
    private final OwnerLocks locks;
    private final RequestValidator validator;

    public TimerStateMachine(SessionStore store, Clock clock, OwnerLocks locks, RequestValidator validator) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.locks = Objects.requireNonNull(locks, "locks");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public WorkDay startWorkDay(String ownerId, String initialActivity) throws TrackingException, StorageException {
        String owner = validator.owner(ownerId);
        Optional<String> activity = validator.activity(initialActivity);
        return locks.withLock(owner, () -> {
            Optional<WorkDay> current = store.load(owner);
            if (current.isPresent() && current.get().isActive()) {
                log.debug("Rejected start for {}: work day {} is already active", owner, current.get().id());
                throw TrackingException.conflict("A work day is already active for " + owner);
            }
            WorkDay started = WorkDay.create(owner, activity).start(clock.instant());
            store.save(started);
            log.info("Work day {} started for {}", started.id(), owner);
            return started;
        });
    }

    public WorkDay stopWorkDay(String ownerId) throws TrackingException, StorageException {
        String owner = validator.owner(ownerId);
        return locks.withLock(owner, () -> {
            WorkDay day = activeWorkDay(store, owner);
            Instant endAt = Durations.notBefore(clock.instant(), day.startedAt().orElseThrow());
            Optional<Meeting> running = day.runningMeeting();
            WorkDay updated = day;
            if (running.isPresent()) {
                endAt = Durations.notBefore(endAt, running.get().startedAt());
                updated = updated.withMeeting(running.get().stop(endAt));
            }
            WorkDay ended = updated.end(endAt);
            store.save(ended);
            running.ifPresent(meeting ->
                    log.info("Meeting {} stopped together with work day {}", meeting.id(), day.id()));
            log.info("Work day {} ended for {}", ended.id(), owner);
            return ended;
        });
    }

    public Meeting startMeeting(String ownerId, String title, String meetingType, int attendeeCount)
            throws TrackingException, StorageException {
        return startMeeting(ownerId, title, validator.meetingType(meetingType), attendeeCount);
    }

    public Meeting startMeeting(String ownerId, String title, MeetingType meetingType, int attendeeCount)
            throws TrackingException, StorageException {
        String owner = validator.owner(ownerId);
        String checkedTitle = validator.title(title);
        int attendees = validator.attendeeCount(attendeeCount);
        MeetingType type = meetingType == null ? MeetingType.OTHER : meetingType;
        return locks.withLock(owner, () -> {
            WorkDay day = activeWorkDay(store, owner);
            Optional<Meeting> running = day.runningMeeting();
            if (running.isPresent()) {
                log.debug("Rejected meeting start for {}: meeting {} is running", owner, running.get().id());
                throw TrackingException.conflict("Meeting '" + running.get().title() + "' is still running");
            }
            Instant startAt = Durations.notBefore(clock.instant(), day.startedAt().orElseThrow());
            Meeting meeting = Meeting.start(day.id(), checkedTitle, type, attendees, startAt);
            store.save(day.withMeeting(meeting));
            log.info("Meeting {} ({}) started in work day {}", meeting.id(), type.label(), day.id());
            return meeting;
        });
    }

    public Meeting stopMeeting(String ownerId, UUID meetingId) throws TrackingException, StorageException {
        String owner = validator.owner(ownerId);
        if (meetingId == null) {
            throw TrackingException.validation("meetingId is required");
        }
        return locks.withLock(owner, () -> {
            WorkDay day = store.load(owner)
                    .orElseThrow(() -> TrackingException.notFound("No work day found for " + owner));
            Meeting meeting = day.findMeeting(meetingId)
                    .orElseThrow(() -> TrackingException.notFound("Meeting " + meetingId + " not found"));
            if (!meeting.isRunning()) {
                log.debug("Rejected stop for {}: meeting {} is {}", owner, meetingId, meeting.status());
                throw TrackingException.invalidState("Meeting " + meetingId + " is not running");
            }
            Meeting stopped = meeting.stop(clock.instant());
            store.save(day.withMeeting(stopped));
            log.info("Meeting {} stopped after {} minute(s)", stopped.id(), stopped.durationMinutes());
            return stopped;
        });
    }

    public WorkDay updateActivity(String ownerId, String activity) throws TrackingException, StorageException {
        String owner = validator.owner(ownerId);
        Optional<String> checked = validator.activity(activity);
        if (checked.isEmpty()) {
            throw TrackingException.validation("activity must not be blank");
        }
        return locks.withLock(owner, () -> {
            WorkDay updated = activeWorkDay(store, owner).withCurrentActivity(checked);
            store.save(updated);
            log.debug("Current activity of {} set to '{}'", owner, checked.get());
            return updated;
        });
    }

    public TrackingStatus status(String ownerId) throws TrackingException, StorageException {
        String owner = validator.owner(ownerId);
        return locks.withLock(owner, () -> TrackingStatus.of(store.load(owner)));
    }

    static WorkDay activeWorkDay(SessionStore store, String owner) throws TrackingException, StorageException {
        Optional<WorkDay> current = store.load(owner);
        if (current.isEmpty() || !current.get().isActive()) {
            throw TrackingException.notFound("No active work day for " + owner);
        }
        return current.get();
    }
}
