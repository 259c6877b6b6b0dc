package com.worklog.model;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Optional;

public enum MeetingType {
    STANDUP,
    PLANNING,
    REVIEW,
    RETROSPECTIVE,
    ONE_ON_ONE,
    CLIENT_CALL,
    TRAINING,
    INTERVIEW,
    BRAINSTORMING,
    DEMO,
    OTHER;

    public static Optional<MeetingType> parse(String value) {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }
        String normalized = value.trim()
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        for (MeetingType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
