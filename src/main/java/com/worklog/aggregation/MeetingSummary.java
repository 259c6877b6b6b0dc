package com.worklog.aggregation;

import com.worklog.model.Durations;
import com.worklog.model.Meeting;
import com.worklog.model.MeetingStatus;
import com.worklog.model.MeetingType;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public record MeetingSummary(
        UUID id,
        UUID workDayId,
        String title,
        MeetingType meetingType,
        int attendeeCount,
        MeetingStatus status,
        Instant startedAt,
        Optional<Instant> stoppedAt,
        int durationMinutes,
        String formattedDuration
) {

    // running meetings count zero minutes
    static MeetingSummary of(Meeting meeting) {
        int minutes = meeting.isRunning() ? 0 : meeting.durationMinutes();
        return new MeetingSummary(
                meeting.id(),
                meeting.workDayId(),
                meeting.title(),
                meeting.meetingType(),
                meeting.attendeeCount(),
                meeting.status(),
                meeting.startedAt(),
                meeting.stoppedAt(),
                minutes,
                Durations.format(minutes));
    }
}
