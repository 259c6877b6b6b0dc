package com.worklog.model;

public enum WorkDayStatus {
    NOT_STARTED,
    ACTIVE,
    ENDED
}
