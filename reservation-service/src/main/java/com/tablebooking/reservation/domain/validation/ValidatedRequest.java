package com.tablebooking.reservation.domain.validation;

import com.tablebooking.reservation.domain.model.TimeWindow;

import java.time.Instant;

/**
 * Reservation parameters that passed validation.
 */
public record ValidatedRequest(int partySize, Instant start, double durationHours) {

    public TimeWindow window() {
        return TimeWindow.of(start, durationHours);
    }
}
