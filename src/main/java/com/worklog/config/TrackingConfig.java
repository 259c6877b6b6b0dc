package com.worklog.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

public record TrackingConfig(
        String zone,
        Long lockTimeoutMillis,
        Integer maxTitleLength,
        Integer maxDescriptionLength,
        Integer maxActivityLength,
        Integer maxCommitHashLength,
        Integer maxJiraTicketLength,
        Integer maxEntryMinutes
) {

    private static final String DEFAULT_ZONE = "UTC";
    private static final long DEFAULT_LOCK_TIMEOUT_MILLIS = 5_000L;
    private static final int DEFAULT_MAX_TITLE = 200;
    private static final int DEFAULT_MAX_DESCRIPTION = 1000;
    private static final int DEFAULT_MAX_ACTIVITY = 500;
    private static final int DEFAULT_MAX_COMMIT_HASH = 40;
    private static final int DEFAULT_MAX_JIRA_TICKET = 50;
    private static final int DEFAULT_MAX_ENTRY_MINUTES = 1440;

    @JsonCreator
    public TrackingConfig(
            @JsonProperty("zone") String zone,
            @JsonProperty("lockTimeoutMillis") Long lockTimeoutMillis,
            @JsonProperty("maxTitleLength") Integer maxTitleLength,
            @JsonProperty("maxDescriptionLength") Integer maxDescriptionLength,
            @JsonProperty("maxActivityLength") Integer maxActivityLength,
            @JsonProperty("maxCommitHashLength") Integer maxCommitHashLength,
            @JsonProperty("maxJiraTicketLength") Integer maxJiraTicketLength,
            @JsonProperty("maxEntryMinutes") Integer maxEntryMinutes
    ) {
        this.zone = zone;
        this.lockTimeoutMillis = lockTimeoutMillis;
        this.maxTitleLength = maxTitleLength;
        this.maxDescriptionLength = maxDescriptionLength;
        this.maxActivityLength = maxActivityLength;
        this.maxCommitHashLength = maxCommitHashLength;
        this.maxJiraTicketLength = maxJiraTicketLength;
        this.maxEntryMinutes = maxEntryMinutes;
    }

    public TrackingConfig withDefaults() {
        return new TrackingConfig(
                isValidZone(zone) ? zone.trim() : DEFAULT_ZONE,
                lockTimeoutMillis == null || lockTimeoutMillis <= 0 ? DEFAULT_LOCK_TIMEOUT_MILLIS : lockTimeoutMillis,
                positiveOr(maxTitleLength, DEFAULT_MAX_TITLE),
                positiveOr(maxDescriptionLength, DEFAULT_MAX_DESCRIPTION),
                positiveOr(maxActivityLength, DEFAULT_MAX_ACTIVITY),
                positiveOr(maxCommitHashLength, DEFAULT_MAX_COMMIT_HASH),
                positiveOr(maxJiraTicketLength, DEFAULT_MAX_JIRA_TICKET),
                positiveOr(maxEntryMinutes, DEFAULT_MAX_ENTRY_MINUTES)
        );
    }

    @JsonIgnore
    public ZoneId zoneId() {
        return isValidZone(zone) ? ZoneId.of(zone.trim()) : ZoneOffset.UTC;
    }

    private static int positiveOr(Integer value, int fallback) {
        return value == null || value <= 0 ? fallback : value;
    }

    private static boolean isValidZone(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        try {
            ZoneId.of(candidate.trim());
            return true;
        } catch (DateTimeException ex) {
            return false;
        }
    }

    public static TrackingConfig defaults() {
        return new TrackingConfig(
                DEFAULT_ZONE,
                DEFAULT_LOCK_TIMEOUT_MILLIS,
                DEFAULT_MAX_TITLE,
                DEFAULT_MAX_DESCRIPTION,
                DEFAULT_MAX_ACTIVITY,
                DEFAULT_MAX_COMMIT_HASH,
                DEFAULT_MAX_JIRA_TICKET,
                DEFAULT_MAX_ENTRY_MINUTES
        );
    }
}
