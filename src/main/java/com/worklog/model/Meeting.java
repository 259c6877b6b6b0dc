package com.worklog.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public record Meeting(
        UUID id,
        UUID workDayId,
        String title,
        MeetingType meetingType,
        int attendeeCount,
        MeetingStatus status,
        Instant startedAt,
        Optional<Instant> stoppedAt,
        int durationMinutes
) {

    public Meeting {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workDayId, "workDayId");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(meetingType, "meetingType");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(stoppedAt, "stoppedAt");
        if (attendeeCount < 0) {
            throw new IllegalArgumentException("attendeeCount must be >= 0");
        }
        if (status == MeetingStatus.STOPPED && (stoppedAt.isEmpty() || durationMinutes < 1)) {
            throw new IllegalArgumentException("stopped meeting needs stoppedAt and a duration >= 1");
        }
    }

    public static Meeting start(UUID workDayId, String title, MeetingType type, int attendeeCount, Instant now) {
        return new Meeting(UUID.randomUUID(), workDayId, title, type, attendeeCount,
                MeetingStatus.RUNNING, now, Optional.empty(), 0);
    }

    public Meeting stop(Instant at) {
        if (!isRunning()) {
            throw new IllegalStateException("Meeting " + id + " is not running");
        }
        Instant stopped = Durations.notBefore(at, startedAt);
        return new Meeting(id, workDayId, title, meetingType, attendeeCount,
                MeetingStatus.STOPPED, startedAt, Optional.of(stopped),
                Durations.ceilMinutes(startedAt, stopped));
    }

    @JsonIgnore
    public boolean isRunning() {
        return status == MeetingStatus.RUNNING;
    }
}
