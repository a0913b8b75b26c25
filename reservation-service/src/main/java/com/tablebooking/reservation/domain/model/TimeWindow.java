package com.tablebooking.reservation.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Closed interval {@code [start, end]} a table is held for.
 */
public record TimeWindow(Instant start, Instant end) {

    private static final double MILLIS_PER_HOUR = 3_600_000d;

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Window end " + end + " must be after start " + start);
        }
    }

    public static TimeWindow of(Instant start, double durationHours) {
        long millis = Math.round(durationHours * MILLIS_PER_HOUR);
        return new TimeWindow(start, start.plusMillis(millis));
    }
}
