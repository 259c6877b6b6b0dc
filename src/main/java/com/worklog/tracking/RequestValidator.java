package com.worklog.tracking;

import com.worklog.config.TrackingConfig;
import com.worklog.model.MeetingType;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;
import java.util.Optional;

public class RequestValidator {

    private final TrackingConfig limits;

    public RequestValidator(TrackingConfig limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    public String owner(String ownerId) throws TrackingException {
        if (StringUtils.isBlank(ownerId)) {
            throw TrackingException.validation("owner must not be blank");
        }
        return ownerId.trim();
    }

    public String title(String title) throws TrackingException {
        return requiredText("title", title, limits.maxTitleLength());
    }

    public String description(String description) throws TrackingException {
        return requiredText("description", description, limits.maxDescriptionLength());
    }

    public Optional<String> activity(String activity) throws TrackingException {
        return optionalText("activity", activity, limits.maxActivityLength());
    }

    public Optional<String> commitHash(Optional<String> commitHash) throws TrackingException {
        return optionalText("commitHash", commitHash.orElse(null), limits.maxCommitHashLength());
    }

    public Optional<String> jiraTicket(Optional<String> jiraTicket) throws TrackingException {
        return optionalText("jiraTicket", jiraTicket.orElse(null), limits.maxJiraTicketLength());
    }

    public Optional<String> project(Optional<String> project) throws TrackingException {
        return optionalText("project", project.orElse(null), limits.maxTitleLength());
    }

    public int durationMinutes(int minutes) throws TrackingException {
        if (minutes <= 0) {
            throw TrackingException.validation("durationMinutes must be > 0, was " + minutes);
        }
        if (minutes > limits.maxEntryMinutes()) {
            throw TrackingException.validation("durationMinutes must be <= " + limits.maxEntryMinutes()
                    + ", was " + minutes);
        }
        return minutes;
    }

    public int attendeeCount(int attendeeCount) throws TrackingException {
        if (attendeeCount < 0) {
            throw TrackingException.validation("attendeeCount must be >= 0, was " + attendeeCount);
        }
        return attendeeCount;
    }

    public MeetingType meetingType(String meetingType) throws TrackingException {
        if (StringUtils.isBlank(meetingType)) {
            return MeetingType.OTHER;
        }
        return MeetingType.parse(meetingType)
                .orElseThrow(() -> TrackingException.validation("Unknown meeting type: " + meetingType));
    }

    private String requiredText(String field, String value, int maxLength) throws TrackingException {
        if (StringUtils.isBlank(value)) {
            throw TrackingException.validation(field + " must not be blank");
        }
        return checkLength(field, value.trim(), maxLength);
    }

    private Optional<String> optionalText(String field, String value, int maxLength) throws TrackingException {
        if (StringUtils.isBlank(value)) {
            return Optional.empty();
        }
        return Optional.of(checkLength(field, value.trim(), maxLength));
    }

    private String checkLength(String field, String value, int maxLength) throws TrackingException {
        if (value.length() > maxLength) {
            throw TrackingException.validation(field + " must be at most " + maxLength + " characters");
        }
        return value;
    }
}
