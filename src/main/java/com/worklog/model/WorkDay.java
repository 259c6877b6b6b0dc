package com.worklog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A work day together with the meetings and entries it owns. Every transition returns a new value,
 * so a reference to a {@code WorkDay} is always a consistent snapshot.
 */
public record WorkDay(
        UUID id,
        String ownerId,
        WorkDayStatus status,
        Optional<Instant> startedAt,
        Optional<Instant> endedAt,
        Optional<String> initialActivity,
        Optional<String> currentActivity,
        List<Meeting> meetings,
        List<TimeEntry> entries
) {

    public WorkDay {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(endedAt, "endedAt");
        Objects.requireNonNull(initialActivity, "initialActivity");
        Objects.requireNonNull(currentActivity, "currentActivity");
        meetings = meetings == null ? List.of() : List.copyOf(meetings);
        entries = entries == null ? List.of() : List.copyOf(entries);
        if (status != WorkDayStatus.NOT_STARTED && startedAt.isEmpty()) {
            throw new IllegalArgumentException("startedAt is required once the work day has started");
        }
        if (status == WorkDayStatus.ENDED && endedAt.isEmpty()) {
            throw new IllegalArgumentException("endedAt is required once the work day has ended");
        }
    }

    public static WorkDay create(String ownerId, Optional<String> initialActivity) {
        return new WorkDay(UUID.randomUUID(), ownerId, WorkDayStatus.NOT_STARTED,
                Optional.empty(), Optional.empty(), initialActivity, initialActivity,
                List.of(), List.of());
    }

    public WorkDay start(Instant now) {
        requireStatus(WorkDayStatus.NOT_STARTED);
        return new WorkDay(id, ownerId, WorkDayStatus.ACTIVE, Optional.of(now), Optional.empty(),
                initialActivity, currentActivity, meetings, entries);
    }

    public WorkDay end(Instant at) {
        requireStatus(WorkDayStatus.ACTIVE);
        if (runningMeeting().isPresent()) {
            throw new IllegalStateException("Work day " + id + " still has a running meeting");
        }
        Instant ended = Durations.notBefore(at, startedAt.orElseThrow());
        return new WorkDay(id, ownerId, WorkDayStatus.ENDED, startedAt, Optional.of(ended),
                initialActivity, currentActivity, meetings, entries);
    }

    public WorkDay withCurrentActivity(Optional<String> activity) {
        requireStatus(WorkDayStatus.ACTIVE);
        return new WorkDay(id, ownerId, status, startedAt, endedAt,
                initialActivity, activity, meetings, entries);
    }

    public WorkDay withMeeting(Meeting meeting) {
        Objects.requireNonNull(meeting, "meeting");
        requireOwned("Meeting " + meeting.id(), meeting.workDayId());
        List<Meeting> updated = new ArrayList<>(meetings.size() + 1);
        boolean replaced = false;
        for (Meeting existing : meetings) {
            if (existing.id().equals(meeting.id())) {
                updated.add(meeting);
                replaced = true;
            } else {
                updated.add(existing);
            }
        }
        if (!replaced) {
            updated.add(meeting);
        }
        return new WorkDay(id, ownerId, status, startedAt, endedAt,
                initialActivity, currentActivity, updated, entries);
    }

    public WorkDay withEntry(TimeEntry entry) {
        Objects.requireNonNull(entry, "entry");
        requireOwned("Entry " + entry.id(), entry.workDayId());
        List<TimeEntry> updated = new ArrayList<>(entries);
        updated.add(entry);
        return new WorkDay(id, ownerId, status, startedAt, endedAt,
                initialActivity, currentActivity, meetings, updated);
    }

    public Optional<Meeting> runningMeeting() {
        return meetings.stream().filter(Meeting::isRunning).findFirst();
    }

    public Optional<Meeting> findMeeting(UUID meetingId) {
        return meetings.stream().filter(m -> m.id().equals(meetingId)).findFirst();
    }

    @JsonIgnore
    public boolean isActive() {
        return status == WorkDayStatus.ACTIVE;
    }

    private void requireOwned(String child, UUID workDayId) {
        if (!id.equals(workDayId)) {
            throw new IllegalArgumentException(child + " belongs to work day " + workDayId + ", not " + id);
        }
    }

    private void requireStatus(WorkDayStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Work day " + id + " is " + status + ", expected " + expected);
        }
    }
}
