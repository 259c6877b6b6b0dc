package com.worklog.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public final class Durations {

    private Durations() {
    }

    /**
     * Elapsed minutes rounded up, never less than one. Spans too long for an {@code int} saturate.
     */
    public static int ceilMinutes(Instant start, Instant end) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Duration elapsed = Duration.between(start, end);
        if (elapsed.isNegative() || elapsed.isZero()) {
            return 1;
        }
        long minutes = elapsed.toMinutes();
        if (elapsed.toSecondsPart() != 0 || elapsed.toNanosPart() != 0) {
            minutes++;
        }
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, minutes));
    }

    public static Instant notBefore(Instant candidate, Instant floor) {
        return candidate.isBefore(floor) ? floor : candidate;
    }

    public static String format(int minutes) {
        int hours = minutes / 60;
        int remainder = minutes % 60;
        if (hours > 0) {
            return remainder > 0 ? hours + "h " + remainder + "m" : hours + "h";
        }
        return remainder + "m";
    }
}
