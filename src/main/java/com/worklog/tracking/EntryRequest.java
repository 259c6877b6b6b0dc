package com.worklog.tracking;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public record EntryRequest(
        Optional<UUID> workDayId,
        String description,
        int durationMinutes,
        Optional<String> commitHash,
        Optional<String> jiraTicket,
        Optional<String> project,
        List<String> tags
) {

    public EntryRequest {
        Objects.requireNonNull(workDayId, "workDayId");
        Objects.requireNonNull(commitHash, "commitHash");
        Objects.requireNonNull(jiraTicket, "jiraTicket");
        Objects.requireNonNull(project, "project");
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static EntryRequest of(String description, int durationMinutes) {
        return new EntryRequest(Optional.empty(), description, durationMinutes,
                Optional.empty(), Optional.empty(), Optional.empty(), List.of());
    }

    public EntryRequest forWorkDay(UUID id) {
        return new EntryRequest(Optional.ofNullable(id), description, durationMinutes,
                commitHash, jiraTicket, project, tags);
    }

    public EntryRequest withCommitHash(String hash) {
        return new EntryRequest(workDayId, description, durationMinutes,
                Optional.ofNullable(hash), jiraTicket, project, tags);
    }

    public EntryRequest withJiraTicket(String ticket) {
        return new EntryRequest(workDayId, description, durationMinutes,
                commitHash, Optional.ofNullable(ticket), project, tags);
    }

    public EntryRequest withProject(String name) {
        return new EntryRequest(workDayId, description, durationMinutes,
                commitHash, jiraTicket, Optional.ofNullable(name), tags);
    }

    public EntryRequest withTags(Collection<String> values) {
        return new EntryRequest(workDayId, description, durationMinutes,
                commitHash, jiraTicket, project,
                values == null ? List.of() : values.stream().filter(Objects::nonNull).toList());
    }

    public EntryRequest withTags(String... values) {
        return withTags(values == null ? List.of() : Arrays.asList(values));
    }
}
