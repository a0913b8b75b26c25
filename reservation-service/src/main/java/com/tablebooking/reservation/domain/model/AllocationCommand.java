package com.tablebooking.reservation.domain.model;

import java.util.Objects;

/**
 * Input of one allocation. {@code replaceId} is set when an existing reservation is being
 * replaced (update) and {@code null} for a fresh booking.
 */
public record AllocationCommand(int partySize, TimeWindow window, Long replaceId) {

    public AllocationCommand {
        Objects.requireNonNull(window, "window");
        if (partySize < 1) {
            throw new IllegalArgumentException("Party size must be positive: " + partySize);
        }
    }

    public static AllocationCommand create(int partySize, TimeWindow window) {
        return new AllocationCommand(partySize, window, null);
    }

    public static AllocationCommand replace(Long replaceId, int partySize, TimeWindow window) {
        return new AllocationCommand(partySize, window, Objects.requireNonNull(replaceId, "replaceId"));
    }

    public boolean isReplace() {
        return replaceId != null;
    }
}
