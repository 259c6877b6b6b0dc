package com.worklog.tracking;

import java.util.Objects;

/**
 * A rejected tracking operation. The aggregate is always left exactly as it was before the call.
 */
public class TrackingException extends Exception {

    private final ErrorKind kind;

    public TrackingException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TrackingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    public static TrackingException conflict(String message) {
        return new TrackingException(ErrorKind.CONFLICT, message);
    }

    public static TrackingException notFound(String message) {
        return new TrackingException(ErrorKind.NOT_FOUND, message);
    }

    public static TrackingException invalidState(String message) {
        return new TrackingException(ErrorKind.INVALID_STATE, message);
    }

    public static TrackingException validation(String message) {
        return new TrackingException(ErrorKind.VALIDATION, message);
    }
}
