package com.worklog.model;

import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

public record TimeEntry(
        UUID id,
        UUID workDayId,
        String description,
        int durationMinutes,
        Instant recordedAt,
        Optional<String> commitHash,
        Optional<String> jiraTicket,
        Optional<String> project,
        Set<String> tags
) {

    public TimeEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(workDayId, "workDayId");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(recordedAt, "recordedAt");
        Objects.requireNonNull(commitHash, "commitHash");
        Objects.requireNonNull(jiraTicket, "jiraTicket");
        Objects.requireNonNull(project, "project");
        if (durationMinutes <= 0) {
            throw new IllegalArgumentException("durationMinutes must be > 0");
        }
        tags = normalizeTags(tags);
    }

    public static SortedSet<String> normalizeTags(Collection<String> raw) {
        SortedSet<String> normalized = new TreeSet<>();
        if (raw != null) {
            raw.stream()
                    .filter(StringUtils::isNotBlank)
                    .map(String::trim)
                    .forEach(normalized::add);
        }
        return Collections.unmodifiableSortedSet(normalized);
    }
}
