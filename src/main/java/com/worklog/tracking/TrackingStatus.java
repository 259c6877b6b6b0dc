package com.worklog.tracking;

import com.worklog.model.Meeting;
import com.worklog.model.WorkDay;

import java.util.Objects;
import java.util.Optional;

public record TrackingStatus(
        Optional<WorkDay> workDay,
        Optional<Meeting> runningMeeting
) {

    public TrackingStatus {
        Objects.requireNonNull(workDay, "workDay");
        Objects.requireNonNull(runningMeeting, "runningMeeting");
    }

    public static TrackingStatus of(Optional<WorkDay> workDay) {
        return new TrackingStatus(workDay, workDay.flatMap(WorkDay::runningMeeting));
    }
}
