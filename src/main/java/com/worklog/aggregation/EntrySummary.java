package com.worklog.aggregation;

import com.worklog.model.Durations;
import com.worklog.model.TimeEntry;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

public record EntrySummary(
        UUID id,
        UUID workDayId,
        String description,
        int durationMinutes,
        Instant recordedAt,
        Optional<String> commitHash,
        Optional<String> jiraTicket,
        Optional<String> project,
        Set<String> tags,
        String formattedDuration
) {

    static EntrySummary of(TimeEntry entry) {
        return new EntrySummary(
                entry.id(),
                entry.workDayId(),
                entry.description(),
                entry.durationMinutes(),
                entry.recordedAt(),
                entry.commitHash(),
                entry.jiraTicket(),
                entry.project(),
                entry.tags(),
                Durations.format(entry.durationMinutes()));
    }
}
