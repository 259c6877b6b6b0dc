package com.worklog.model;

public enum MeetingStatus {
    RUNNING,
    STOPPED
}
