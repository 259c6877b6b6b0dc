package com.worklog.tracking;

public enum ErrorKind {
    CONFLICT,
    NOT_FOUND,
    INVALID_STATE,
    VALIDATION
}
