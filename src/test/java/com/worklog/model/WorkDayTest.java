package com.worklog.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkDayTest {

    private static final Instant T0 = Instant.parse("2024-03-01T09:00:00Z");

    @Test
    void shouldNotEndWhileMeetingRuns() {
        WorkDay day = WorkDay.create("alice", Optional.empty()).start(T0);
        WorkDay withMeeting = day.withMeeting(Meeting.start(day.id(), "Sync", MeetingType.OTHER, 2, T0));

        assertThrows(IllegalStateException.class, () -> withMeeting.end(T0.plusSeconds(600)));
    }

    @Test
    void shouldClampEndToStart() {
        WorkDay ended = WorkDay.create("alice", Optional.empty()).start(T0).end(T0.minusSeconds(30));

        assertEquals(WorkDayStatus.ENDED, ended.status());
        assertEquals(Optional.of(T0), ended.endedAt());
    }

    @Test
    void shouldReplaceMeetingInPlace() {
        WorkDay day = WorkDay.create("alice", Optional.of("planning sprint")).start(T0);
        Meeting first = Meeting.start(day.id(), "Standup", MeetingType.STANDUP, 5, T0);
        WorkDay running = day.withMeeting(first);
        WorkDay stopped = running.withMeeting(first.stop(T0.plusSeconds(900)));

        assertEquals(1, stopped.meetings().size());
        assertEquals(15, stopped.meetings().get(0).durationMinutes());
        assertTrue(stopped.runningMeeting().isEmpty());
        assertTrue(running.runningMeeting().isPresent(), "earlier snapshot must stay untouched");
    }

    @Test
    void shouldRejectMeetingOfAnotherWorkDay() {
        WorkDay day = WorkDay.create("alice", Optional.empty()).start(T0);
        Meeting foreign = Meeting.start(UUID.randomUUID(), "Sync", MeetingType.OTHER, 2, T0);

        assertThrows(IllegalArgumentException.class, () -> day.withMeeting(foreign));
        assertTrue(day.meetings().isEmpty());
    }

    @Test
    void shouldRejectEntryOfAnotherWorkDay() {
        WorkDay day = WorkDay.create("alice", Optional.empty()).start(T0);
        TimeEntry foreign = new TimeEntry(UUID.randomUUID(), UUID.randomUUID(), "Review", 20, T0,
                Optional.empty(), Optional.empty(), Optional.empty(), Set.of());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> day.withEntry(foreign));
        assertTrue(ex.getMessage().contains(day.id().toString()));
    }

    @Test
    void shouldRejectStoppedMeetingWithoutDuration() {
        assertThrows(IllegalArgumentException.class, () -> new Meeting(UUID.randomUUID(), UUID.randomUUID(),
                "Demo", MeetingType.DEMO, 0, MeetingStatus.STOPPED, T0, Optional.of(T0), 0));
    }

    @Test
    void shouldNormalizeEntryTags() {
        TimeEntry entry = new TimeEntry(UUID.randomUUID(), UUID.randomUUID(), "Review", 20, T0,
                Optional.empty(), Optional.empty(), Optional.empty(),
                new HashSet<>(List.of(" backend ", "", "api", "backend")));

        assertEquals(List.of("api", "backend"), List.copyOf(entry.tags()));
    }

    @Test
    void shouldRejectNonPositiveEntryDuration() {
        assertThrows(IllegalArgumentException.class, () -> new TimeEntry(UUID.randomUUID(), UUID.randomUUID(),
                "Nothing", 0, T0, Optional.empty(), Optional.empty(), Optional.empty(), Set.of()));
    }
}
